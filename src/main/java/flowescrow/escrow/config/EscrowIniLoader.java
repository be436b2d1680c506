package flowescrow.escrow.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads escrow settings from an INI file.
 * Supports sections [DATABASE], [SERVER], [ESCROW]; every section and key is optional.
 *
 * <pre>
 * [DATABASE]
 * url = jdbc:h2:file:./data/flowescrow;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE
 * pool_size = 10
 *
 * [SERVER]
 * host = 0.0.0.0
 * port = 8080
 *
 * [ESCROW]
 * deployer = 0xabc...
 * fee_bps = 500
 * fee_recipient = 0xdef...
 * custody_account = escrow
 * </pre>
 */
public final class EscrowIniLoader {

    private static final Logger log = LoggerFactory.getLogger(EscrowIniLoader.class);

    private EscrowIniLoader() {
    }

    /** Load a file on top of the defaults */
    public static EscrowConfig load(Path file) {
        return apply(file, EscrowConfig.defaults());
    }

    /**
     * Overlay the values present in the file onto {@code config}.
     *
     * @throws IllegalArgumentException if the file cannot be read or holds a malformed number
     */
    public static EscrowConfig apply(Path file, EscrowConfig config) {
        Ini ini;
        try {
            ini = new Ini(file.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read escrow config " + file + ": " + e.getMessage(), e);
        }

        Profile.Section db = ini.get("DATABASE");
        Profile.Section server = ini.get("SERVER");
        Profile.Section escrow = ini.get("ESCROW");

        if (db != null) {
            String url = opt(db, "url");
            if (url != null) config.withDatabaseUrl(url);
            String pool = opt(db, "pool_size");
            if (pool != null) config.withDatabasePoolSize(parseInt(pool, "DATABASE.pool_size"));
        }

        if (server != null) {
            String host = opt(server, "host");
            if (host != null) config.withServerHost(host);
            String port = opt(server, "port");
            if (port != null) config.withServerPort(parseInt(port, "SERVER.port"));
        }

        if (escrow != null) {
            String deployer = opt(escrow, "deployer");
            if (deployer != null) config.withDeployer(deployer);
            String feeBps = opt(escrow, "fee_bps");
            if (feeBps != null) config.withInitialFeeBps(parseInt(feeBps, "ESCROW.fee_bps"));
            String recipient = opt(escrow, "fee_recipient");
            if (recipient != null) config.withInitialFeeRecipient(recipient);
            String custody = opt(escrow, "custody_account");
            if (custody != null) config.withCustodyAccount(custody);
        }

        log.info("Loaded escrow config from {}", file);
        return config;
    }

    private static String opt(Profile.Section section, String key) {
        String value = section.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String value, String key) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + value, e);
        }
    }
}
