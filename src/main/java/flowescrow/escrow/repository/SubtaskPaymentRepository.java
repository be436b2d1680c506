package flowescrow.escrow.repository;

import flowescrow.escrow.model.SubtaskPayment;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for per-subtask settlement records.
 * A key that was never approved has no record.
 */
public interface SubtaskPaymentRepository {

    /**
     * Find a settlement record inside the caller's transaction.
     */
    Optional<SubtaskPayment> find(Connection conn, long taskId, int subtaskIndex) throws SQLException;

    /**
     * Record the key as paid.
     *
     * @throws SQLException if the key already has a record
     */
    void markPaid(Connection conn, SubtaskPayment payment) throws SQLException;

    /**
     * Find a settlement record.
     */
    Optional<SubtaskPayment> find(long taskId, int subtaskIndex);

    /**
     * All settlement records of a task, ordered by subtask index.
     */
    List<SubtaskPayment> findByTask(long taskId);

    /**
     * Sum of gross amounts over the paid subtasks of a task.
     */
    long sumPaid(long taskId);
}
