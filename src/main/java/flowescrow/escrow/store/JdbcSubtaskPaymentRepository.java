package flowescrow.escrow.store;

import flowescrow.escrow.model.SubtaskPayment;
import flowescrow.escrow.repository.SubtaskPaymentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of SubtaskPaymentRepository.
 * The (task_id, subtask_index) primary key makes a second insert for a settled key fail.
 */
public class JdbcSubtaskPaymentRepository implements SubtaskPaymentRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcSubtaskPaymentRepository.class);

    private final Database db;

    public JdbcSubtaskPaymentRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<SubtaskPayment> find(Connection conn, long taskId, int subtaskIndex) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM subtask_payments WHERE task_id = ? AND subtask_index = ?")) {
            ps.setLong(1, taskId);
            ps.setInt(2, subtaskIndex);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public void markPaid(Connection conn, SubtaskPayment payment) throws SQLException {
        String sql = """
                    INSERT INTO subtask_payments (task_id, subtask_index, worker, amount, paid, paid_at)
                    VALUES (?, ?, ?, ?, TRUE, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, payment.taskId());
            ps.setInt(2, payment.subtaskIndex());
            ps.setString(3, payment.worker());
            ps.setLong(4, payment.amount());
            ps.setTimestamp(5, Timestamp.from(payment.paidAt() != null ? payment.paidAt() : Instant.now()));
            ps.executeUpdate();
        }

        log.debug("Subtask {}/{} marked paid to {} ({})",
                payment.taskId(), payment.subtaskIndex(), payment.worker(), payment.amount());
    }

    @Override
    public Optional<SubtaskPayment> find(long taskId, int subtaskIndex) {
        try (Connection conn = db.getConnection()) {
            return find(conn, taskId, subtaskIndex);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find subtask payment: " + taskId + "/" + subtaskIndex, e);
        }
    }

    @Override
    public List<SubtaskPayment> findByTask(long taskId) {
        String sql = "SELECT * FROM subtask_payments WHERE task_id = ? ORDER BY subtask_index";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, taskId);
            List<SubtaskPayment> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find subtask payments for task: " + taskId, e);
        }
    }

    @Override
    public long sumPaid(long taskId) {
        String sql = "SELECT COALESCE(SUM(amount), 0) FROM subtask_payments WHERE task_id = ? AND paid = TRUE";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to sum subtask payments for task: " + taskId, e);
        }
    }

    private SubtaskPayment mapRow(ResultSet rs) throws SQLException {
        Timestamp paidAt = rs.getTimestamp("paid_at");
        return new SubtaskPayment(
                rs.getLong("task_id"),
                rs.getInt("subtask_index"),
                rs.getString("worker"),
                rs.getLong("amount"),
                rs.getBoolean("paid"),
                paidAt != null ? paidAt.toInstant() : null);
    }
}
