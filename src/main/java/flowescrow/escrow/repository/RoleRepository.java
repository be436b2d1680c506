package flowescrow.escrow.repository;

import flowescrow.escrow.model.Role;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Repository interface for role membership.
 */
public interface RoleRepository {

    boolean hasRole(Connection conn, Role role, String account) throws SQLException;

    /**
     * @return true if the account did not hold the role before
     */
    boolean grant(Connection conn, Role role, String account) throws SQLException;

    /**
     * @return true if the account held the role before
     */
    boolean revoke(Connection conn, Role role, String account) throws SQLException;

    /**
     * True when no account holds any role, i.e. the ledger was never initialized.
     */
    boolean isEmpty(Connection conn) throws SQLException;

    boolean hasRole(Role role, String account);

    List<String> members(Role role);
}
