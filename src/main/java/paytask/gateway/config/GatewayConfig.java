package paytask.gateway.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for gateway settings.
 * All settings have sensible defaults.
 */
public final class GatewayConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/paytask;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Ledger settings
    private String ledgerUrl = "http://localhost:4943/ledger";
    private Duration ledgerTimeout = Duration.ofSeconds(10);
    private String serviceIdentity = "paytask-gateway";

    // Order settings
    private Duration orderReservationPeriod = Duration.ofSeconds(120);
    private Duration indexReconcileInterval = Duration.ofMinutes(5);

    // Initialization
    private Path feesFile = null; // INI file with a [FEES] section, optional
    private String adminKey = null; // If set, /internal/ calls must provide X-Paytask-Key header

    private GatewayConfig() {
    }

    public static GatewayConfig defaults() {
        return new GatewayConfig();
    }

    public static GatewayConfig fromEnv() {
        GatewayConfig config = new GatewayConfig();

        String dbUrl = System.getenv("PAYTASK_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("PAYTASK_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String ledgerUrl = System.getenv("PAYTASK_LEDGER_URL");
        if (ledgerUrl != null && !ledgerUrl.isBlank()) {
            config.ledgerUrl = ledgerUrl;
        }

        String identity = System.getenv("PAYTASK_SERVICE_IDENTITY");
        if (identity != null && !identity.isBlank()) {
            config.serviceIdentity = identity;
        }

        String reservation = System.getenv("PAYTASK_RESERVATION_SECONDS");
        if (reservation != null && !reservation.isBlank()) {
            config.orderReservationPeriod = Duration.ofSeconds(Long.parseLong(reservation));
        }

        String feesFile = System.getenv("PAYTASK_FEES_FILE");
        if (feesFile != null && !feesFile.isBlank()) {
            config.feesFile = Path.of(feesFile);
        }

        String adminKey = System.getenv("PAYTASK_ADMIN_KEY");
        if (adminKey != null && !adminKey.isBlank()) {
            config.adminKey = adminKey;
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

    public String ledgerUrl() {
        return ledgerUrl;
    }

    public Duration ledgerTimeout() {
        return ledgerTimeout;
    }

    public String serviceIdentity() {
        return serviceIdentity;
    }

    public Duration orderReservationPeriod() {
        return orderReservationPeriod;
    }

    public Duration indexReconcileInterval() {
        return indexReconcileInterval;
    }

    public Path feesFile() {
        return feesFile;
    }

    public String adminKey() {
        return adminKey;
    }

    public boolean hasAdminKey() {
        return adminKey != null && !adminKey.isBlank();
    }

    // Fluent setters for testing/customization
    public GatewayConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public GatewayConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public GatewayConfig withLedgerUrl(String url) {
        this.ledgerUrl = url;
        return this;
    }

    public GatewayConfig withLedgerTimeout(Duration timeout) {
        this.ledgerTimeout = timeout;
        return this;
    }

    public GatewayConfig withServiceIdentity(String identity) {
        this.serviceIdentity = identity;
        return this;
    }

    public GatewayConfig withOrderReservationPeriod(Duration period) {
        this.orderReservationPeriod = period;
        return this;
    }

    public GatewayConfig withIndexReconcileInterval(Duration interval) {
        this.indexReconcileInterval = interval;
        return this;
    }

    public GatewayConfig withFeesFile(Path file) {
        this.feesFile = file;
        return this;
    }

    public GatewayConfig withAdminKey(String key) {
        this.adminKey = key;
        return this;
    }

    @Override
    public String toString() {
        return "GatewayConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", ledgerUrl='" + ledgerUrl + '\'' +
                ", serviceIdentity='" + serviceIdentity + '\'' +
                ", reservation=" + orderReservationPeriod +
                ", feesFile=" + feesFile +
                ", adminKeySet=" + hasAdminKey() +
                '}';
    }
}
