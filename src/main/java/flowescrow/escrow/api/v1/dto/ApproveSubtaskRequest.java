package flowescrow.escrow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for paying a subtask.
 * POST /api/v1/tasks/{taskId}/subtasks/{index}/approve
 */
public record ApproveSubtaskRequest(
        @JsonProperty("worker") String worker,
        @JsonProperty("amount") Long amount) {

    public void validate() {
        if (amount == null) {
            throw new IllegalArgumentException("amount is required");
        }
    }
}
