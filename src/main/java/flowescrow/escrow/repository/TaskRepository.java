package flowescrow.escrow.repository;

import flowescrow.escrow.model.Task;
import flowescrow.escrow.model.TaskStatus;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for escrow task records.
 * Methods taking a {@link Connection} join the caller's transaction and never commit;
 * the others run on their own connection and are read-only.
 */
public interface TaskRepository {

    /**
     * Advance the task id counter and return the new value.
     * Ids start at 1 and are never reused.
     */
    long allocateId(Connection conn) throws SQLException;

    /**
     * Insert a new task.
     *
     * @param task the task to insert; its id must come from {@link #allocateId}
     */
    void insert(Connection conn, Task task) throws SQLException;

    /**
     * Find a task and lock its row for the rest of the transaction.
     *
     * @param taskId the task id
     * @return the task if found
     */
    Optional<Task> findForUpdate(Connection conn, long taskId) throws SQLException;

    /**
     * Persist the mutable fields of a task: released amount and status.
     *
     * @throws SQLException if no row was updated
     */
    void update(Connection conn, Task task) throws SQLException;

    /**
     * Find a task by id.
     *
     * @param taskId the task id
     * @return the task if found
     */
    Optional<Task> findById(long taskId);

    /**
     * Tasks funded by a client, newest first.
     *
     * @param client the funding account
     * @param limit  maximum number of results
     */
    List<Task> findByClient(String client, int limit);

    /**
     * Current value of the id counter, i.e. the id of the most recently funded task.
     */
    long taskCount();

    /**
     * Count tasks in a status.
     */
    int countByStatus(TaskStatus status);
}
