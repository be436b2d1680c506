package flowescrow.escrow.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Named monotonic counters in {@code ledger_counters}.
 */
final class LedgerCounters {

    static final String TASK = "task";
    static final String EVENT = "event";

    private LedgerCounters() {
    }

    /** Increment in the caller's transaction; the row stays locked until it ends */
    static long next(Connection conn, String name) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE ledger_counters SET counter_value = counter_value + 1 WHERE name = ?")) {
            ps.setString(1, name);
            if (ps.executeUpdate() != 1) {
                throw new SQLException("Counter " + name + " missing");
            }
        }
        return current(conn, name);
    }

    static long current(Connection conn, String name) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT counter_value FROM ledger_counters WHERE name = ?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Counter " + name + " missing");
                }
                return rs.getLong(1);
            }
        }
    }
}
