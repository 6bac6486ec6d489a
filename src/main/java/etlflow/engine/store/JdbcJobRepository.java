package etlflow.engine.store;

import etlflow.engine.model.Job;
import etlflow.engine.model.JobKind;
import etlflow.engine.model.JobStatus;
import etlflow.engine.model.ScheduleKind;
import etlflow.engine.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Job job) {
        String sql = """
                    INSERT INTO jobs (id, name, description, job_type, command, working_directory, environment_vars,
                                      schedule_type, cron_expression, interval_minutes, enabled, status, last_run, next_run,
                                      max_retries, retry_delay_seconds, timeout_seconds, notification_target,
                                      notify_on_success, notify_on_failure, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = Instant.now();
            ps.setString(1, job.id());
            ps.setString(2, job.name());
            ps.setString(3, job.description());
            ps.setString(4, job.kind().name());
            ps.setString(5, job.command());
            ps.setString(6, job.workingDirectory());
            ps.setString(7, job.environment());
            ps.setString(8, job.scheduleKind().name());
            ps.setString(9, job.cronExpression());
            setNullableInt(ps, 10, job.intervalMinutes());
            ps.setBoolean(11, job.enabled());
            ps.setString(12, job.status().name());
            ps.setTimestamp(13, toTimestamp(job.lastRun()));
            ps.setTimestamp(14, toTimestamp(job.nextRun()));
            ps.setInt(15, job.maxRetries());
            ps.setInt(16, job.retryDelaySeconds());
            setNullableInt(ps, 17, job.timeoutSeconds());
            ps.setString(18, job.notificationTarget());
            ps.setBoolean(19, job.notifyOnSuccess());
            ps.setBoolean(20, job.notifyOnFailure());
            ps.setTimestamp(21, Timestamp.from(job.createdAt() != null ? job.createdAt() : now));
            ps.setTimestamp(22, Timestamp.from(now));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved job: {} ({})", job.name(), job.id());
        } catch (SQLIntegrityConstraintViolationException e) {
            throw new IllegalArgumentException("Job name or id already exists: " + job.name(), e);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save job: " + job.name(), e);
        }
    }

    @Override
    public boolean update(Job job) {
        String sql = """
                    UPDATE jobs SET name = ?, description = ?, job_type = ?, command = ?, working_directory = ?,
                                    environment_vars = ?, schedule_type = ?, cron_expression = ?, interval_minutes = ?,
                                    enabled = ?, max_retries = ?, retry_delay_seconds = ?, timeout_seconds = ?,
                                    notification_target = ?, notify_on_success = ?, notify_on_failure = ?,
                                    updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.name());
            ps.setString(2, job.description());
            ps.setString(3, job.kind().name());
            ps.setString(4, job.command());
            ps.setString(5, job.workingDirectory());
            ps.setString(6, job.environment());
            ps.setString(7, job.scheduleKind().name());
            ps.setString(8, job.cronExpression());
            setNullableInt(ps, 9, job.intervalMinutes());
            ps.setBoolean(10, job.enabled());
            ps.setInt(11, job.maxRetries());
            ps.setInt(12, job.retryDelaySeconds());
            setNullableInt(ps, 13, job.timeoutSeconds());
            ps.setString(14, job.notificationTarget());
            ps.setBoolean(15, job.notifyOnSuccess());
            ps.setBoolean(16, job.notifyOnFailure());
            ps.setTimestamp(17, Timestamp.from(Instant.now()));
            ps.setString(18, job.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLIntegrityConstraintViolationException e) {
            throw new IllegalArgumentException("Job name already exists: " + job.name(), e);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update job: " + job.id(), e);
        }
    }

    @Override
    public boolean delete(String jobId) {
        // Edges and executions first, then the job, in one transaction
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(
                    "DELETE FROM job_dependencies WHERE job_id = ? OR depends_on_job_id = ?")) {
                ps.setString(1, jobId);
                ps.setString(2, jobId);
                ps.executeUpdate();
            }

            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM job_executions WHERE job_id = ?")) {
                ps.setString(1, jobId);
                ps.executeUpdate();
            }

            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
                ps.setString(1, jobId);
                int deleted = ps.executeUpdate();
                conn.commit();
                return deleted > 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete job: " + jobId, e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        return findOne("SELECT * FROM jobs WHERE id = ?", jobId);
    }

    @Override
    public Optional<Job> findByName(String name) {
        return findOne("SELECT * FROM jobs WHERE name = ?", name);
    }

    @Override
    public List<Job> findAll() {
        return executeQuery("SELECT * FROM jobs ORDER BY name");
    }

    @Override
    public List<Job> findEnabled() {
        return executeQuery("SELECT * FROM jobs WHERE enabled = TRUE ORDER BY name");
    }

    @Override
    public boolean updateStatus(String jobId, JobStatus status) {
        String sql = "UPDATE jobs SET status = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update job status: " + jobId, e);
        }
    }

    @Override
    public boolean updateLastRun(String jobId, Instant lastRun) {
        String sql = "UPDATE jobs SET last_run = ?, next_run = NULL, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, toTimestamp(lastRun));
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update last run: " + jobId, e);
        }
    }

    @Override
    public boolean updateNextRun(String jobId, Instant nextRun) {
        String sql = "UPDATE jobs SET next_run = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, toTimestamp(nextRun));
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update next run: " + jobId, e);
        }
    }

    @Override
    public boolean setEnabled(String jobId, boolean enabled) {
        String sql = "UPDATE jobs SET enabled = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBoolean(1, enabled);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to toggle job: " + jobId, e);
        }
    }

    @Override
    public int resetRunning() {
        String sql = "UPDATE jobs SET status = 'IDLE', updated_at = ? WHERE status = 'RUNNING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            int updated = ps.executeUpdate();
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reset running jobs", e);
        }
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // --- Helpers ---

    private Optional<Job> findOne(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + param, e);
        }
    }

    private List<Job> executeQuery(String sql) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to execute query", e);
        }
    }

    List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    static Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .kind(JobKind.valueOf(rs.getString("job_type")))
                .command(rs.getString("command"))
                .workingDirectory(rs.getString("working_directory"))
                .environment(rs.getString("environment_vars"))
                .scheduleKind(ScheduleKind.valueOf(rs.getString("schedule_type")))
                .cronExpression(rs.getString("cron_expression"))
                .intervalMinutes(getNullableInt(rs, "interval_minutes"))
                .enabled(rs.getBoolean("enabled"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .lastRun(toInstant(rs.getTimestamp("last_run")))
                .nextRun(toInstant(rs.getTimestamp("next_run")))
                .maxRetries(rs.getInt("max_retries"))
                .retryDelaySeconds(rs.getInt("retry_delay_seconds"))
                .timeoutSeconds(getNullableInt(rs, "timeout_seconds"))
                .notificationTarget(rs.getString("notification_target"))
                .notifyOnSuccess(rs.getBoolean("notify_on_success"))
                .notifyOnFailure(rs.getBoolean("notify_on_failure"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
