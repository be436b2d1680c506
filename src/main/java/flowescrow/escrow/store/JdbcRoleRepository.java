package flowescrow.escrow.store;

import flowescrow.escrow.model.Role;
import flowescrow.escrow.repository.RoleRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of RoleRepository.
 */
public class JdbcRoleRepository implements RoleRepository {

    private final Database db;

    public JdbcRoleRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean hasRole(Connection conn, Role role, String account) throws SQLException {
        if (account == null) {
            return false;
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM role_members WHERE role_name = ? AND account = ?")) {
            ps.setString(1, role.name());
            ps.setString(2, account);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public boolean grant(Connection conn, Role role, String account) throws SQLException {
        if (hasRole(conn, role, account)) {
            return false;
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO role_members (role_name, account, granted_at) VALUES (?, ?, ?)")) {
            ps.setString(1, role.name());
            ps.setString(2, account);
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            ps.executeUpdate();
        }
        return true;
    }

    @Override
    public boolean revoke(Connection conn, Role role, String account) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM role_members WHERE role_name = ? AND account = ?")) {
            ps.setString(1, role.name());
            ps.setString(2, account);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public boolean isEmpty(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM role_members")) {
            return rs.next() && rs.getLong(1) == 0;
        }
    }

    @Override
    public boolean hasRole(Role role, String account) {
        try (Connection conn = db.getConnection()) {
            return hasRole(conn, role, account);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to check role " + role + " for " + account, e);
        }
    }

    @Override
    public List<String> members(Role role) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "SELECT account FROM role_members WHERE role_name = ? ORDER BY granted_at, account")) {
            ps.setString(1, role.name());
            List<String> accounts = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    accounts.add(rs.getString(1));
                }
            }
            return accounts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list members of " + role, e);
        }
    }
}
