package flowescrow.escrow.asset;

import flowescrow.escrow.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;

/**
 * Token balances kept in the escrow database ({@code token_balances}).
 * Escrowed funds sit on the custody account.
 */
public class JdbcTokenLedger implements FungibleAsset {

    private static final Logger log = LoggerFactory.getLogger(JdbcTokenLedger.class);

    private final Database db;
    private final String custodyAccount;

    public JdbcTokenLedger(Database db, String custodyAccount) {
        if (custodyAccount == null || custodyAccount.isBlank()) {
            throw new IllegalArgumentException("custodyAccount is required");
        }
        this.db = db;
        this.custodyAccount = custodyAccount;
    }

    @Override
    public String custodyAccount() {
        return custodyAccount;
    }

    @Override
    public boolean debitFrom(Connection tx, String payer, long amount) throws SQLException {
        if (payer == null || payer.isBlank() || payer.equals(custodyAccount)) {
            return false;
        }
        return move(tx, payer, custodyAccount, amount);
    }

    @Override
    public boolean creditTo(Connection tx, String recipient, long amount) throws SQLException {
        if (recipient == null || recipient.isBlank() || recipient.equals(custodyAccount)) {
            return false;
        }
        return move(tx, custodyAccount, recipient, amount);
    }

    @Override
    public long balanceOf(String account) {
        try (Connection conn = db.getConnection()) {
            return balanceOf(conn, account);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read balance of " + account, e);
        }
    }

    /**
     * Create new tokens on an account in its own transaction. Used to seed wallets.
     */
    public void mint(String account, long amount) {
        if (account == null || account.isBlank()) {
            throw new IllegalArgumentException("account is required");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        db.inTransaction("mint to " + account, conn -> mint(conn, account, amount));
    }

    @Override
    public boolean mint(Connection tx, String account, long amount) throws SQLException {
        if (account == null || account.isBlank() || account.equals(custodyAccount) || amount <= 0) {
            return false;
        }
        ensureAccount(tx, account);
        try (PreparedStatement ps = tx.prepareStatement(
                "UPDATE token_balances SET balance = balance + ? WHERE account = ?")) {
            ps.setLong(1, amount);
            ps.setString(2, account);
            ps.executeUpdate();
        }
        log.info("Minted {} to {}", amount, account);
        return true;
    }

    private boolean move(Connection tx, String from, String to, long amount) throws SQLException {
        if (amount < 0) {
            return false;
        }
        if (amount == 0) {
            return true;
        }
        // Conditional decrement: the row is untouched when the balance is short
        try (PreparedStatement ps = tx.prepareStatement(
                "UPDATE token_balances SET balance = balance - ? WHERE account = ? AND balance >= ?")) {
            ps.setLong(1, amount);
            ps.setString(2, from);
            ps.setLong(3, amount);
            if (ps.executeUpdate() != 1) {
                log.warn("Transfer of {} from {} to {} rejected: insufficient balance", amount, from, to);
                return false;
            }
        }
        ensureAccount(tx, to);
        try (PreparedStatement ps = tx.prepareStatement(
                "UPDATE token_balances SET balance = balance + ? WHERE account = ?")) {
            ps.setLong(1, amount);
            ps.setString(2, to);
            ps.executeUpdate();
        }
        return true;
    }

    private static long balanceOf(Connection conn, String account) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT balance FROM token_balances WHERE account = ?")) {
            ps.setString(1, account);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    /**
     * Create the balance row if it is missing. A concurrent writer may create the same row
     * between the lookup and the insert; the unique key then rejects ours and the row exists.
     */
    private static void ensureAccount(Connection conn, String account) throws SQLException {
        try (PreparedStatement select = conn.prepareStatement("SELECT 1 FROM token_balances WHERE account = ?")) {
            select.setString(1, account);
            try (ResultSet rs = select.executeQuery()) {
                if (rs.next()) {
                    return;
                }
            }
        }
        try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO token_balances (account, balance) VALUES (?, 0)")) {
            insert.setString(1, account);
            insert.executeUpdate();
        } catch (SQLIntegrityConstraintViolationException e) {
            log.debug("Balance row for {} created concurrently", account);
        }
    }
}
