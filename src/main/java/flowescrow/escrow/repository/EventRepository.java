package flowescrow.escrow.repository;

import flowescrow.escrow.model.EscrowEvent;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Append-only audit event stream.
 */
public interface EventRepository {

    /**
     * Append an event in the caller's transaction.
     *
     * @return the event with its assigned sequence number
     */
    EscrowEvent append(Connection conn, EscrowEvent event) throws SQLException;

    /**
     * Events with a sequence greater than {@code afterSequence}, oldest first.
     */
    List<EscrowEvent> findAfter(long afterSequence, int limit);

    /**
     * All events of one task, oldest first.
     */
    List<EscrowEvent> findByTask(long taskId);

    Optional<EscrowEvent> findBySequence(long sequence);
}
