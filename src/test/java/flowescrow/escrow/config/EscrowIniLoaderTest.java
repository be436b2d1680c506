package flowescrow.escrow.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EscrowIniLoaderTest {

    @TempDir
    Path dir;

    @Test
    void loadsAllSections() throws Exception {
        Path file = dir.resolve("escrow.ini");
        Files.writeString(file, """
                [DATABASE]
                url = jdbc:h2:mem:from-ini
                pool_size = 4

                [SERVER]
                host = 127.0.0.1
                port = 9090

                [ESCROW]
                deployer = ops
                fee_bps = 250
                fee_recipient = treasury
                custody_account = vault
                """);

        EscrowConfig config = EscrowIniLoader.load(file);

        assertEquals("jdbc:h2:mem:from-ini", config.databaseUrl());
        assertEquals(4, config.databasePoolSize());
        assertEquals("127.0.0.1", config.serverHost());
        assertEquals(9090, config.serverPort());
        assertEquals("ops", config.deployer());
        assertEquals(250, config.initialFeeBps());
        assertEquals("treasury", config.initialFeeRecipient());
        assertEquals("vault", config.custodyAccount());
    }

    @Test
    void missingKeysKeepDefaults() throws Exception {
        Path file = dir.resolve("partial.ini");
        Files.writeString(file, """
                [ESCROW]
                deployer = ops
                """);

        EscrowConfig config = EscrowIniLoader.load(file);
        EscrowConfig defaults = EscrowConfig.defaults();

        assertEquals(defaults.databaseUrl(), config.databaseUrl());
        assertEquals(defaults.serverPort(), config.serverPort());
        assertEquals(500, config.initialFeeBps());
        // recipient falls back to the deployer
        assertEquals("ops", config.initialFeeRecipient());
    }

    @Test
    void malformedNumberIsRejected() throws Exception {
        Path file = dir.resolve("bad.ini");
        Files.writeString(file, """
                [SERVER]
                port = eighty
                """);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> EscrowIniLoader.load(file));
        assertTrue(e.getMessage().contains("SERVER.port"), e.getMessage());
    }

    @Test
    void missingFileIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> EscrowIniLoader.load(dir.resolve("absent.ini")));
    }
}
