package flowescrow.escrow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import flowescrow.escrow.model.Task;

import java.time.Instant;

/**
 * Response DTO for task details.
 * GET /api/v1/tasks/{taskId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("taskId") long taskId,
        @JsonProperty("client") String client,
        @JsonProperty("totalAmount") long totalAmount,
        @JsonProperty("releasedAmount") long releasedAmount,
        @JsonProperty("remainingAmount") long remainingAmount,
        @JsonProperty("status") String status,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    /** Create response from domain model */
    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.client(),
                task.totalAmount(),
                task.releasedAmount(),
                task.remainingAmount(),
                task.status().name(),
                task.createdAt(),
                task.updatedAt());
    }
}
