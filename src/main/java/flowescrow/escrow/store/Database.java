package flowescrow.escrow.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import flowescrow.escrow.config.EscrowConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    /**
     * Unit of work run on one connection inside one transaction.
     */
    @FunctionalInterface
    public interface TransactionCallback<T> {
        T execute(Connection conn) throws SQLException;
    }

    public Database(EscrowConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("flowescrow-db-pool");
        hikariConfig.setAutoCommit(false);

        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Run {@code callback} in a single transaction.
     * Commits when it returns normally; rolls back on any exception and rethrows it.
     * A {@link SQLException} is wrapped with {@code what} as context.
     */
    public <T> T inTransaction(String what, TransactionCallback<T> callback) {
        try (Connection conn = getConnection()) {
            try {
                T result = callback.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + what, e);
        }
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS escrow_tasks (
                            id              BIGINT PRIMARY KEY,
                            client          VARCHAR(128) NOT NULL,
                            total_amount    BIGINT NOT NULL,
                            released_amount BIGINT NOT NULL DEFAULT 0,
                            status          VARCHAR(20) NOT NULL,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT chk_budget CHECK (released_amount >= 0 AND released_amount <= total_amount),
                            CONSTRAINT chk_total CHECK (total_amount > 0)
                        );
                    """);

            // ---------- SUBTASK PAYMENTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS subtask_payments (
                            task_id         BIGINT NOT NULL,
                            subtask_index   INT NOT NULL,
                            worker          VARCHAR(128) NOT NULL,
                            amount          BIGINT NOT NULL,
                            paid            BOOLEAN NOT NULL DEFAULT FALSE,
                            paid_at         TIMESTAMP,
                            PRIMARY KEY (task_id, subtask_index),
                            CONSTRAINT fk_payment_task FOREIGN KEY (task_id) REFERENCES escrow_tasks(id)
                        );
                    """);

            // ---------- FEE POLICY (single row) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS fee_policy (
                            id              INT PRIMARY KEY,
                            fee_bps         INT NOT NULL,
                            fee_recipient   VARCHAR(128) NOT NULL,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT chk_single_row CHECK (id = 1)
                        );
                    """);

            // ---------- ROLES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS role_members (
                            role_name       VARCHAR(32) NOT NULL,
                            account         VARCHAR(128) NOT NULL,
                            granted_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            PRIMARY KEY (role_name, account)
                        );
                    """);

            // ---------- COUNTERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS ledger_counters (
                            name            VARCHAR(32) PRIMARY KEY,
                            counter_value   BIGINT NOT NULL
                        );
                    """);

            // ---------- EVENTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS escrow_events (
                            seq             BIGINT PRIMARY KEY,
                            event_type      VARCHAR(32) NOT NULL,
                            task_id         BIGINT NOT NULL,
                            actor           VARCHAR(128),
                            details         CLOB NOT NULL,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- TOKEN BALANCES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS token_balances (
                            account         VARCHAR(128) PRIMARY KEY,
                            balance         BIGINT NOT NULL DEFAULT 0,
                            CONSTRAINT chk_balance CHECK (balance >= 0)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_client ON escrow_tasks(client, id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status ON escrow_tasks(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_events_task ON escrow_events(task_id, seq);");

            st.executeBatch();
            ensureCounter(conn, "task");
            ensureCounter(conn, "event");
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    private static void ensureCounter(Connection conn, String name) throws SQLException {
        try (PreparedStatement select = conn.prepareStatement(
                "SELECT 1 FROM ledger_counters WHERE name = ?")) {
            select.setString(1, name);
            try (ResultSet rs = select.executeQuery()) {
                if (rs.next()) {
                    return;
                }
            }
        }
        try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO ledger_counters (name, counter_value) VALUES (?, 0)")) {
            insert.setString(1, name);
            insert.executeUpdate();
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
