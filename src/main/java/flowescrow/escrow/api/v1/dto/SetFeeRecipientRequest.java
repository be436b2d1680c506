package flowescrow.escrow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * PUT /api/v1/fee/recipient
 */
public record SetFeeRecipientRequest(
        @JsonProperty("recipient") String recipient) {
}
