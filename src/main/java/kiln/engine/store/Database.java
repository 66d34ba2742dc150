package kiln.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import kiln.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection pool and schema for the task history store.
 * Uses HikariCP; connections are handed out with auto-commit off.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("kiln-history-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("History database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

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

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_history (
                            id              BIGINT AUTO_INCREMENT PRIMARY KEY,
                            task_id         VARCHAR(128) NOT NULL,
                            task_type       VARCHAR(64) NOT NULL,
                            outcome         VARCHAR(20) NOT NULL,
                            worker_id       VARCHAR(64),
                            duration_ms     BIGINT DEFAULT 0,
                            error_message   VARCHAR(2048),
                            finished_at     TIMESTAMP NOT NULL
                        );
                    """);
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_history_task ON task_history(task_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_history_finished ON task_history(finished_at);");

            st.executeBatch();
            conn.commit();

            log.info("History schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize history schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("History database pool closed");
        }
    }
}
