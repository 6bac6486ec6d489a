package etlflow.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import etlflow.engine.config.EngineConfig;
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

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("etlflow-db-pool");
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

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id                  VARCHAR(64) PRIMARY KEY,
                            name                VARCHAR(255) NOT NULL UNIQUE,
                            description         VARCHAR(4096),
                            job_type            VARCHAR(16) NOT NULL,
                            command             CLOB NOT NULL,
                            working_directory   VARCHAR(1024),
                            environment_vars    CLOB,
                            schedule_type       VARCHAR(16) DEFAULT 'MANUAL' NOT NULL,
                            cron_expression     VARCHAR(255),
                            interval_minutes    INT,
                            enabled             BOOLEAN DEFAULT TRUE NOT NULL,
                            status              VARCHAR(16) DEFAULT 'IDLE' NOT NULL,
                            last_run            TIMESTAMP,
                            next_run            TIMESTAMP,
                            max_retries         INT DEFAULT 0 NOT NULL,
                            retry_delay_seconds INT DEFAULT 60 NOT NULL,
                            timeout_seconds     INT,
                            notification_target VARCHAR(1024),
                            notify_on_success   BOOLEAN DEFAULT FALSE NOT NULL,
                            notify_on_failure   BOOLEAN DEFAULT TRUE NOT NULL,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- DEPENDENCIES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_dependencies (
                            job_id              VARCHAR(64) NOT NULL,
                            depends_on_job_id   VARCHAR(64) NOT NULL,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            PRIMARY KEY (job_id, depends_on_job_id),
                            FOREIGN KEY (job_id) REFERENCES jobs(id) ON DELETE CASCADE,
                            FOREIGN KEY (depends_on_job_id) REFERENCES jobs(id) ON DELETE CASCADE
                        );
                    """);

            // ---------- EXECUTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_executions (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            job_id          VARCHAR(64) NOT NULL,
                            start_time      TIMESTAMP NOT NULL,
                            end_time        TIMESTAMP,
                            status          VARCHAR(16) NOT NULL,
                            exit_code       INT,
                            output          CLOB,
                            error_output    CLOB,
                            retry_count     INT DEFAULT 0 NOT NULL,
                            triggered_by    VARCHAR(16) DEFAULT 'SCHEDULER' NOT NULL,
                            FOREIGN KEY (job_id) REFERENCES jobs(id) ON DELETE CASCADE
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_enabled ON jobs(enabled);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_deps_depends_on ON job_dependencies(depends_on_job_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_executions_job_start ON job_executions(job_id, start_time DESC);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_executions_status ON job_executions(status);");

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
