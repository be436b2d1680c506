package flowescrow.escrow.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import flowescrow.escrow.model.EscrowEvent;
import flowescrow.escrow.model.EscrowEventType;
import flowescrow.escrow.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of EventRepository. Details are stored as a JSON object.
 * Rows are only ever inserted.
 */
public class JdbcEventRepository implements EventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    private final Database db;

    public JdbcEventRepository(Database db) {
        this.db = db;
    }

    @Override
    public EscrowEvent append(Connection conn, EscrowEvent event) throws SQLException {
        long sequence = LedgerCounters.next(conn, LedgerCounters.EVENT);
        String sql = """
                    INSERT INTO escrow_events (seq, event_type, task_id, actor, details, created_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, sequence);
            ps.setString(2, event.type().name());
            ps.setLong(3, event.taskId());
            ps.setString(4, event.actor());
            ps.setString(5, writeDetails(event.details()));
            ps.setTimestamp(6, Timestamp.from(event.createdAt() != null ? event.createdAt() : Instant.now()));
            ps.executeUpdate();
        }

        log.debug("Appended event #{} {} for task {}", sequence, event.type(), event.taskId());
        return event.withSequence(sequence);
    }

    @Override
    public List<EscrowEvent> findAfter(long afterSequence, int limit) {
        String sql = "SELECT * FROM escrow_events WHERE seq > ? ORDER BY seq LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, afterSequence);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read events after " + afterSequence, e);
        }
    }

    @Override
    public List<EscrowEvent> findByTask(long taskId) {
        String sql = "SELECT * FROM escrow_events WHERE task_id = ? ORDER BY seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, taskId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read events for task " + taskId, e);
        }
    }

    @Override
    public Optional<EscrowEvent> findBySequence(long sequence) {
        String sql = "SELECT * FROM escrow_events WHERE seq = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, sequence);
            List<EscrowEvent> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read event " + sequence, e);
        }
    }

    // Helper methods

    private List<EscrowEvent> executeQuery(PreparedStatement ps) throws SQLException {
        List<EscrowEvent> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private EscrowEvent mapRow(ResultSet rs) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new EscrowEvent(
                rs.getLong("seq"),
                EscrowEventType.valueOf(rs.getString("event_type")),
                rs.getLong("task_id"),
                rs.getString("actor"),
                readDetails(rs.getString("details")),
                createdAt != null ? createdAt.toInstant() : null);
    }

    private static String writeDetails(Map<String, Object> details) throws SQLException {
        try {
            return MAPPER.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot serialize event details: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> readDetails(String json) throws SQLException {
        try {
            return MAPPER.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt event details: " + e.getMessage(), e);
        }
    }
}
