package flowescrow.escrow.repository;

import flowescrow.escrow.model.FeePolicy;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Repository interface for the single fee policy row.
 */
public interface FeePolicyRepository {

    /**
     * Read the policy inside the caller's transaction.
     */
    Optional<FeePolicy> find(Connection conn) throws SQLException;

    /**
     * Insert or replace the policy.
     */
    void save(Connection conn, FeePolicy policy) throws SQLException;

    /**
     * Read the current policy.
     */
    Optional<FeePolicy> find();
}
