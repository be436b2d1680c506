package flowescrow.escrow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for arbitrating a dispute.
 * POST /api/v1/tasks/{taskId}/resolve
 */
public record ResolveDisputeRequest(
        @JsonProperty("winner") String winner,
        @JsonProperty("winnerAmount") Long winnerAmount) {

    public void validate() {
        if (winnerAmount == null) {
            throw new IllegalArgumentException("winnerAmount is required");
        }
    }
}
