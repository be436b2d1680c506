package flowescrow.escrow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * PUT /api/v1/fee
 */
public record SetFeeRequest(
        @JsonProperty("feeBps") Integer feeBps) {

    public void validate() {
        if (feeBps == null) {
            throw new IllegalArgumentException("feeBps is required");
        }
    }
}
