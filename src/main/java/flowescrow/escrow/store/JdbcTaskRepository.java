package flowescrow.escrow.store;

import flowescrow.escrow.model.Task;
import flowescrow.escrow.model.TaskStatus;
import flowescrow.escrow.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository.
 * Row locks are taken with SELECT ... FOR UPDATE inside the caller's transaction.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public long allocateId(Connection conn) throws SQLException {
        return LedgerCounters.next(conn, LedgerCounters.TASK);
    }

    @Override
    public void insert(Connection conn, Task task) throws SQLException {
        String sql = """
                    INSERT INTO escrow_tasks (id, client, total_amount, released_amount, status, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            Instant createdAt = task.createdAt() != null ? task.createdAt() : Instant.now();
            ps.setLong(1, task.id());
            ps.setString(2, task.client());
            ps.setLong(3, task.totalAmount());
            ps.setLong(4, task.releasedAmount());
            ps.setString(5, task.status().name());
            ps.setTimestamp(6, Timestamp.from(createdAt));
            ps.setTimestamp(7, Timestamp.from(createdAt));
            ps.executeUpdate();
        }

        log.debug("Inserted task {} for client {} ({})", task.id(), task.client(), task.totalAmount());
    }

    @Override
    public Optional<Task> findForUpdate(Connection conn, long taskId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM escrow_tasks WHERE id = ? FOR UPDATE")) {
            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public void update(Connection conn, Task task) throws SQLException {
        String sql = """
                    UPDATE escrow_tasks
                    SET released_amount = ?, status = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, task.releasedAmount());
            ps.setString(2, task.status().name());
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            ps.setLong(4, task.id());

            int updated = ps.executeUpdate();
            if (updated != 1) {
                throw new SQLException("Task update failed: task " + task.id() + " updated " + updated + " rows");
            }
        }
    }

    @Override
    public Optional<Task> findById(long taskId) {
        String sql = "SELECT * FROM escrow_tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findByClient(String client, int limit) {
        String sql = "SELECT * FROM escrow_tasks WHERE client = ? ORDER BY id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, client);
            ps.setInt(2, limit);
            List<Task> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tasks for client: " + client, e);
        }
    }

    @Override
    public long taskCount() {
        try (Connection conn = db.getConnection()) {
            return LedgerCounters.current(conn, LedgerCounters.TASK);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read task counter", e);
        }
    }

    @Override
    public int countByStatus(TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM escrow_tasks WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks by status: " + status, e);
        }
    }

    // Helper methods

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getLong("id"))
                .client(rs.getString("client"))
                .totalAmount(rs.getLong("total_amount"))
                .releasedAmount(rs.getLong("released_amount"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
