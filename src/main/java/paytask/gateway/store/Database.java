package paytask.gateway.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import paytask.gateway.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(GatewayConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("paytask-db-pool");
        hikariConfig.setAutoCommit(false);

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

            // ---------- PENDING ORDERS (memo -> order) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS pending_orders (
                            memo            BIGINT PRIMARY KEY,
                            order_id        VARCHAR(64) NOT NULL,
                            fee             BIGINT NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            payer           VARCHAR(256) NOT NULL,
                            paid_at_block   BIGINT,
                            created_at      TIMESTAMP(9) NOT NULL
                        );
                    """);

            // ---------- SETTLED ORDERS (payer -> latest order) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS settled_orders (
                            payer           VARCHAR(256) PRIMARY KEY,
                            memo            BIGINT NOT NULL,
                            order_id        VARCHAR(64) NOT NULL,
                            fee             BIGINT NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            paid_at_block   BIGINT,
                            created_at      TIMESTAMP(9) NOT NULL
                        );
                    """);

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id              VARCHAR(64) PRIMARY KEY,
                            name            VARCHAR(1024) NOT NULL,
                            description     CLOB NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            created_at      TIMESTAMP(9) NOT NULL,
                            due_date        TIMESTAMP(9),
                            owner           VARCHAR(256) NOT NULL
                        );
                    """);

            // ---------- OWNER INDEX ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS owner_tasks (
                            seq             BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            owner           VARCHAR(256) NOT NULL,
                            task_id         VARCHAR(64) NOT NULL,
                            CONSTRAINT uq_owner_task UNIQUE (owner, task_id)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_pending_created ON pending_orders(created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status ON tasks(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_owner_tasks_owner ON owner_tasks(owner, seq);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
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
