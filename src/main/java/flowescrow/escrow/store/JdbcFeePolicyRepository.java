package flowescrow.escrow.store;

import flowescrow.escrow.model.FeePolicy;
import flowescrow.escrow.repository.FeePolicyRepository;

import java.sql.*;
import java.time.Instant;
import java.util.Optional;

/**
 * JDBC implementation of FeePolicyRepository, backed by the single-row {@code fee_policy} table.
 */
public class JdbcFeePolicyRepository implements FeePolicyRepository {

    private final Database db;

    public JdbcFeePolicyRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<FeePolicy> find(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT fee_bps, fee_recipient FROM fee_policy WHERE id = 1")) {
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new FeePolicy(rs.getInt("fee_bps"), rs.getString("fee_recipient")));
            }
        }
    }

    @Override
    public void save(Connection conn, FeePolicy policy) throws SQLException {
        Timestamp now = Timestamp.from(Instant.now());
        try (PreparedStatement update = conn.prepareStatement(
                "UPDATE fee_policy SET fee_bps = ?, fee_recipient = ?, updated_at = ? WHERE id = 1")) {
            update.setInt(1, policy.feeBps());
            update.setString(2, policy.feeRecipient());
            update.setTimestamp(3, now);
            if (update.executeUpdate() == 1) {
                return;
            }
        }
        try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO fee_policy (id, fee_bps, fee_recipient, updated_at) VALUES (1, ?, ?, ?)")) {
            insert.setInt(1, policy.feeBps());
            insert.setString(2, policy.feeRecipient());
            insert.setTimestamp(3, now);
            insert.executeUpdate();
        }
    }

    @Override
    public Optional<FeePolicy> find() {
        try (Connection conn = db.getConnection()) {
            return find(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read fee policy", e);
        }
    }
}
