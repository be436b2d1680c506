package flowescrow.escrow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for funding a task.
 * POST /api/v1/tasks
 */
public record FundRequest(
        @JsonProperty("amount") Long amount) {

    /** Validate the request */
    public void validate() {
        if (amount == null) {
            throw new IllegalArgumentException("amount is required");
        }
    }
}
