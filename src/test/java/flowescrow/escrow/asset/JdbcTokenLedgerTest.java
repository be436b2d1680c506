package flowescrow.escrow.asset;

import flowescrow.escrow.config.EscrowConfig;
import flowescrow.escrow.store.Database;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTokenLedgerTest {

    private Database db;
    private JdbcTokenLedger ledger;

    @BeforeEach
    void setUp() {
        db = new Database(EscrowConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-ledger-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
        ledger = new JdbcTokenLedger(db, "escrow");
        ledger.mint("alice", 1_000);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void debitMovesIntoCustody() {
        boolean moved = db.inTransaction("debit", conn -> ledger.debitFrom(conn, "alice", 400));

        assertTrue(moved);
        assertEquals(600, ledger.balanceOf("alice"));
        assertEquals(400, ledger.balanceOf("escrow"));
    }

    @Test
    void creditMovesOutOfCustody() {
        db.inTransaction("debit", conn -> ledger.debitFrom(conn, "alice", 400));

        boolean moved = db.inTransaction("credit", conn -> ledger.creditTo(conn, "bob", 150));

        assertTrue(moved);
        assertEquals(150, ledger.balanceOf("bob"));
        assertEquals(250, ledger.balanceOf("escrow"));
    }

    @Test
    void insufficientBalanceIsRefused() {
        boolean overdraw = db.inTransaction("overdraw", conn -> ledger.debitFrom(conn, "alice", 1_001));
        boolean emptyCustody = db.inTransaction("empty custody", conn -> ledger.creditTo(conn, "bob", 1));
        boolean unknownPayer = db.inTransaction("unknown payer", conn -> ledger.debitFrom(conn, "nobody", 1));

        assertFalse(overdraw);
        assertFalse(emptyCustody);
        assertFalse(unknownPayer);
        assertEquals(1_000, ledger.balanceOf("alice"));
        assertEquals(0, ledger.balanceOf("bob"));
    }

    @Test
    void invalidPartiesAreRefused() {
        boolean blank = db.inTransaction("blank", conn -> ledger.debitFrom(conn, " ", 1));
        boolean custody = db.inTransaction("custody", conn -> ledger.creditTo(conn, "escrow", 1));
        boolean negative = db.inTransaction("negative", conn -> ledger.debitFrom(conn, "alice", -1));
        boolean zero = db.inTransaction("zero", conn -> ledger.creditTo(conn, "bob", 0));

        assertFalse(blank);
        assertFalse(custody);
        assertFalse(negative);
        assertTrue(zero);
    }

    @Test
    void rollbackUndoesTransfers() {
        assertThrows(IllegalStateException.class, () -> db.inTransaction("debit then fail", conn -> {
            ledger.debitFrom(conn, "alice", 500);
            throw new IllegalStateException("abort");
        }));

        assertEquals(1_000, ledger.balanceOf("alice"));
        assertEquals(0, ledger.balanceOf("escrow"));
    }

    @Test
    void mintValidatesInput() {
        assertThrows(IllegalArgumentException.class, () -> ledger.mint("alice", 0));
        assertThrows(IllegalArgumentException.class, () -> ledger.mint("", 10));
        ledger.mint("alice", 5);
        assertEquals(1_005, ledger.balanceOf("alice"));
    }

    @Test
    void mintInsideTransaction() {
        boolean toCustody = db.inTransaction("mint custody", conn -> ledger.mint(conn, "escrow", 10));
        boolean zero = db.inTransaction("mint zero", conn -> ledger.mint(conn, "carol", 0));
        boolean minted = db.inTransaction("mint carol", conn -> ledger.mint(conn, "carol", 10));

        assertFalse(toCustody);
        assertFalse(zero);
        assertTrue(minted);
        assertEquals(10, ledger.balanceOf("carol"));
        assertEquals(0, ledger.balanceOf("escrow"));
    }
}
