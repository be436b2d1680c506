package flowescrow.escrow.config;

import java.nio.file.Path;

/**
 * Configuration holder for the escrow service.
 * All settings have sensible defaults.
 */
public final class EscrowConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/flowescrow;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Ledger bootstrap, applied once to an empty database
    private String deployer = "deployer";
    private int initialFeeBps = 500;
    private String initialFeeRecipient = null; // falls back to deployer
    private String custodyAccount = "escrow";

    private EscrowConfig() {
    }

    public static EscrowConfig defaults() {
        return new EscrowConfig();
    }

    /**
     * Defaults, then the INI file named by FLOWESCROW_CONFIG if present, then
     * individual environment variables.
     */
    public static EscrowConfig fromEnv() {
        EscrowConfig config = new EscrowConfig();

        String iniPath = System.getenv("FLOWESCROW_CONFIG");
        if (iniPath != null && !iniPath.isBlank()) {
            EscrowIniLoader.apply(Path.of(iniPath), config);
        }

        String dbUrl = System.getenv("FLOWESCROW_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("FLOWESCROW_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String deployer = System.getenv("FLOWESCROW_DEPLOYER");
        if (deployer != null && !deployer.isBlank()) {
            config.deployer = deployer;
        }

        String feeBps = System.getenv("FLOWESCROW_FEE_BPS");
        if (feeBps != null && !feeBps.isBlank()) {
            config.initialFeeBps = Integer.parseInt(feeBps);
        }

        String feeRecipient = System.getenv("FLOWESCROW_FEE_RECIPIENT");
        if (feeRecipient != null && !feeRecipient.isBlank()) {
            config.initialFeeRecipient = feeRecipient;
        }

        String custody = System.getenv("FLOWESCROW_CUSTODY_ACCOUNT");
        if (custody != null && !custody.isBlank()) {
            config.custodyAccount = custody;
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String deployer() {
        return deployer;
    }

    public int initialFeeBps() {
        return initialFeeBps;
    }

    public String initialFeeRecipient() {
        return initialFeeRecipient != null ? initialFeeRecipient : deployer;
    }

    public String custodyAccount() {
        return custodyAccount;
    }

    // Fluent setters for testing/customization
    public EscrowConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EscrowConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public EscrowConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public EscrowConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public EscrowConfig withDeployer(String deployer) {
        this.deployer = deployer;
        return this;
    }

    public EscrowConfig withInitialFeeBps(int feeBps) {
        this.initialFeeBps = feeBps;
        return this;
    }

    public EscrowConfig withInitialFeeRecipient(String recipient) {
        this.initialFeeRecipient = recipient;
        return this;
    }

    public EscrowConfig withCustodyAccount(String account) {
        this.custodyAccount = account;
        return this;
    }

    @Override
    public String toString() {
        return "EscrowConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", deployer='" + deployer + '\'' +
                ", initialFeeBps=" + initialFeeBps +
                ", custodyAccount='" + custodyAccount + '\'' +
                '}';
    }
}
