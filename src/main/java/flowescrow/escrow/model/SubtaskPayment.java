package flowescrow.escrow.model;

import java.time.Instant;

/**
 * Settlement record for one subtask of a task, keyed by (taskId, subtaskIndex).
 * Once {@code paid} is true the key is settled for good.
 *
 * @param amount gross amount attributed to the subtask, before the fee split
 */
public record SubtaskPayment(
        long taskId,
        int subtaskIndex,
        String worker,
        long amount,
        boolean paid,
        Instant paidAt) {
}
