package flowescrow.escrow.service;

import flowescrow.escrow.model.EscrowError;
import flowescrow.escrow.model.EscrowException;
import flowescrow.escrow.model.Role;
import flowescrow.escrow.model.Task;
import flowescrow.escrow.repository.RoleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Resolves callers against {client-of-task, admin}.
 * Checks that run inside an operation take its connection so they see the same snapshot.
 */
public class AccessControl {

    private static final Logger log = LoggerFactory.getLogger(AccessControl.class);

    private final RoleRepository roleRepository;

    public AccessControl(RoleRepository roleRepository) {
        this.roleRepository = roleRepository;
    }

    public static boolean isValidIdentity(String account) {
        return account != null && !account.isBlank();
    }

    public boolean isAdmin(String account) {
        return roleRepository.hasRole(Role.ADMIN, account);
    }

    public boolean hasRole(Role role, String account) {
        return roleRepository.hasRole(role, account);
    }

    public List<String> members(Role role) {
        return roleRepository.members(role);
    }

    public void requireAdmin(Connection conn, String caller) throws SQLException {
        if (!roleRepository.hasRole(conn, Role.ADMIN, caller)) {
            log.warn("Caller {} is not an admin", caller);
            throw new EscrowException(EscrowError.UNAUTHORIZED, "caller " + caller + " is not an admin");
        }
    }

    public void requireClientOrAdmin(Connection conn, Task task, String caller) throws SQLException {
        if (caller != null && task.isClient(caller)) {
            return;
        }
        if (!roleRepository.hasRole(conn, Role.ADMIN, caller)) {
            log.warn("Caller {} is neither client nor admin of task {}", caller, task.id());
            throw new EscrowException(EscrowError.UNAUTHORIZED,
                    "caller " + caller + " is neither the client of task " + task.id() + " nor an admin");
        }
    }

    /**
     * Grant a role. The caller must hold the role's admin role.
     *
     * @return true if membership changed
     */
    public boolean grantRole(Connection conn, String caller, Role role, String account) throws SQLException {
        requireRoleAdmin(conn, caller, role);
        requireIdentity(account);
        return roleRepository.grant(conn, role, account);
    }

    /**
     * Revoke a role. The caller must hold the role's admin role.
     *
     * @return true if membership changed
     */
    public boolean revokeRole(Connection conn, String caller, Role role, String account) throws SQLException {
        requireRoleAdmin(conn, caller, role);
        requireIdentity(account);
        return roleRepository.revoke(conn, role, account);
    }

    /**
     * Give the deployer every role if nobody holds any yet.
     *
     * @return true if the roles were granted now
     */
    public boolean bootstrap(Connection conn, String deployer) throws SQLException {
        requireIdentity(deployer);
        if (!roleRepository.isEmpty(conn)) {
            return false;
        }
        for (Role role : Role.values()) {
            roleRepository.grant(conn, role, deployer);
        }
        log.info("Granted {} to deployer {}", List.of(Role.values()), deployer);
        return true;
    }

    private void requireRoleAdmin(Connection conn, String caller, Role role) throws SQLException {
        if (!roleRepository.hasRole(conn, role.adminRole(), caller)) {
            log.warn("Caller {} may not manage role {}", caller, role);
            throw new EscrowException(EscrowError.UNAUTHORIZED,
                    "caller " + caller + " lacks " + role.adminRole() + " to manage " + role);
        }
    }

    private static void requireIdentity(String account) {
        if (!isValidIdentity(account)) {
            throw new EscrowException(EscrowError.INVALID_ADDRESS, "account is required");
        }
    }
}
