package flowescrow.escrow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import flowescrow.escrow.model.SubtaskPayment;

import java.time.Instant;

/**
 * Response DTO for a paid subtask.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubtaskPaymentResponse(
        @JsonProperty("taskId") long taskId,
        @JsonProperty("subtaskIndex") int subtaskIndex,
        @JsonProperty("worker") String worker,
        @JsonProperty("amount") long amount,
        @JsonProperty("paid") boolean paid,
        @JsonProperty("paidAt") Instant paidAt) {

    public static SubtaskPaymentResponse from(SubtaskPayment payment) {
        return new SubtaskPaymentResponse(
                payment.taskId(),
                payment.subtaskIndex(),
                payment.worker(),
                payment.amount(),
                payment.paid(),
                payment.paidAt());
    }
}
