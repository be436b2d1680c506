package flowescrow.escrow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import flowescrow.escrow.model.FeePolicy;

/**
 * Response DTO for the current platform fee.
 * GET /api/v1/fee
 */
public record FeeResponse(
        @JsonProperty("feeBps") int feeBps,
        @JsonProperty("feeRecipient") String feeRecipient,
        @JsonProperty("maxFeeBps") int maxFeeBps) {

    public static FeeResponse from(FeePolicy policy) {
        return new FeeResponse(policy.feeBps(), policy.feeRecipient(), FeePolicy.MAX_FEE_BPS);
    }
}
