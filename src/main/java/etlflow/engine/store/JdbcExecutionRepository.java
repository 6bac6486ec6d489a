package etlflow.engine.store;

import etlflow.engine.model.Execution;
import etlflow.engine.model.ExecutionStatus;
import etlflow.engine.model.TriggerSource;
import etlflow.engine.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static etlflow.engine.store.JdbcJobRepository.getNullableInt;
import static etlflow.engine.store.JdbcJobRepository.setNullableInt;
import static etlflow.engine.store.JdbcJobRepository.toInstant;

/**
 * JDBC implementation of ExecutionRepository.
 */
public class JdbcExecutionRepository implements ExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionRepository.class);

    private final Database db;

    public JdbcExecutionRepository(Database db) {
        this.db = db;
    }

    @Override
    public long create(String jobId, TriggerSource triggeredBy) {
        String sql = """
                    INSERT INTO job_executions (job_id, start_time, status, triggered_by)
                    VALUES (?, ?, 'RUNNING', ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, jobId);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, triggeredBy.name());
            ps.executeUpdate();

            long id;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No generated key returned for execution of " + jobId);
                }
                id = keys.getLong(1);
            }
            conn.commit();

            log.debug("Created execution {} for job {} ({})", id, jobId, triggeredBy);
            return id;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create execution for job: " + jobId, e);
        }
    }

    @Override
    public boolean finish(long executionId, ExecutionStatus status, Integer exitCode, String output,
            String errorOutput, int retryCount) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Execution can only finish in a terminal status, got " + status);
        }

        // Only a RUNNING record can be finalized; terminal records are immutable
        String sql = """
                    UPDATE job_executions
                    SET end_time = ?, status = ?, exit_code = ?, output = ?, error_output = ?, retry_count = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, status.name());
            setNullableInt(ps, 3, exitCode);
            ps.setString(4, output);
            ps.setString(5, errorOutput);
            ps.setInt(6, retryCount);
            ps.setLong(7, executionId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to finish execution: " + executionId, e);
        }
    }

    @Override
    public Optional<Execution> findById(long executionId) {
        String sql = "SELECT * FROM job_executions WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs, false));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find execution: " + executionId, e);
        }
    }

    @Override
    public Optional<Execution> findLatestByJobId(String jobId) {
        List<Execution> latest = findByJobId(jobId, 1);
        return latest.isEmpty() ? Optional.empty() : Optional.of(latest.get(0));
    }

    @Override
    public List<Execution> findByJobId(String jobId, int limit) {
        String sql = """
                    SELECT * FROM job_executions
                    WHERE job_id = ?
                    ORDER BY start_time DESC, id DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setInt(2, limit);
            return executeQuery(ps, false);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find executions of job: " + jobId, e);
        }
    }

    @Override
    public List<Execution> findAll(int limit, ExecutionStatus status) {
        String sql = status != null
                ? """
                    SELECT e.*, j.name AS job_name FROM job_executions e
                    JOIN jobs j ON e.job_id = j.id
                    WHERE e.status = ?
                    ORDER BY e.start_time DESC, e.id DESC
                    LIMIT ?
                """
                : """
                    SELECT e.*, j.name AS job_name FROM job_executions e
                    JOIN jobs j ON e.job_id = j.id
                    ORDER BY e.start_time DESC, e.id DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int index = 1;
            if (status != null) {
                ps.setString(index++, status.name());
            }
            ps.setInt(index, limit);
            return executeQuery(ps, true);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list executions", e);
        }
    }

    @Override
    public int markAbandoned(String reason) {
        String sql = """
                    UPDATE job_executions
                    SET status = 'FAILED', end_time = ?, exit_code = COALESCE(exit_code, 1),
                        error_output = COALESCE(error_output, '') || ?
                    WHERE status = 'RUNNING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, reason);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark abandoned executions", e);
        }
    }

    // --- Helpers ---

    private List<Execution> executeQuery(PreparedStatement ps, boolean withJobName) throws SQLException {
        List<Execution> executions = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                executions.add(mapRow(rs, withJobName));
            }
        }
        return executions;
    }

    private Execution mapRow(ResultSet rs, boolean withJobName) throws SQLException {
        return Execution.builder()
                .id(rs.getLong("id"))
                .jobId(rs.getString("job_id"))
                .jobName(withJobName ? rs.getString("job_name") : null)
                .startTime(toInstant(rs.getTimestamp("start_time")))
                .endTime(toInstant(rs.getTimestamp("end_time")))
                .status(ExecutionStatus.valueOf(rs.getString("status")))
                .exitCode(getNullableInt(rs, "exit_code"))
                .output(rs.getString("output"))
                .errorOutput(rs.getString("error_output"))
                .retryCount(rs.getInt("retry_count"))
                .triggeredBy(TriggerSource.valueOf(rs.getString("triggered_by")))
                .build();
    }
}
