package etlflow.engine.store;

import etlflow.engine.model.Job;
import etlflow.engine.repository.DependencyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JDBC implementation of DependencyRepository.
 */
public class JdbcDependencyRepository implements DependencyRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcDependencyRepository.class);

    /** SQLSTATE for a unique/primary key violation */
    private static final String DUPLICATE_KEY = "23505";

    private final Database db;

    public JdbcDependencyRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean add(String jobId, String prerequisiteId) {
        String sql = "INSERT INTO job_dependencies (job_id, depends_on_job_id, created_at) VALUES (?, ?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setString(2, prerequisiteId);
            ps.setTimestamp(3, new Timestamp(System.currentTimeMillis()));
            ps.executeUpdate();
            conn.commit();

            log.debug("Added dependency {} -> {}", jobId, prerequisiteId);
            return true;
        } catch (SQLIntegrityConstraintViolationException e) {
            if (DUPLICATE_KEY.equals(e.getSQLState())) {
                log.debug("Dependency {} -> {} already exists", jobId, prerequisiteId);
                return false;
            }
            throw new IllegalArgumentException("Unknown job in dependency " + jobId + " -> " + prerequisiteId, e);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to add dependency " + jobId + " -> " + prerequisiteId, e);
        }
    }

    @Override
    public boolean remove(String jobId, String prerequisiteId) {
        String sql = "DELETE FROM job_dependencies WHERE job_id = ? AND depends_on_job_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setString(2, prerequisiteId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to remove dependency " + jobId + " -> " + prerequisiteId, e);
        }
    }

    @Override
    public List<String> findPrerequisites(String jobId) {
        String sql = "SELECT depends_on_job_id FROM job_dependencies WHERE job_id = ? ORDER BY created_at, depends_on_job_id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            List<String> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find prerequisites of " + jobId, e);
        }
    }

    @Override
    public List<Job> findDependents(String jobId) {
        String sql = """
                    SELECT j.* FROM jobs j
                    JOIN job_dependencies d ON j.id = d.job_id
                    WHERE d.depends_on_job_id = ?
                    ORDER BY j.name
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            List<Job> jobs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    jobs.add(JdbcJobRepository.mapRow(rs));
                }
            }
            return jobs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find dependents of " + jobId, e);
        }
    }

    @Override
    public Map<String, Set<String>> findAll() {
        String sql = "SELECT job_id, depends_on_job_id FROM job_dependencies";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            Map<String, Set<String>> graph = new HashMap<>();
            while (rs.next()) {
                graph.computeIfAbsent(rs.getString(1), k -> new LinkedHashSet<>()).add(rs.getString(2));
            }
            return graph;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load dependency graph", e);
        }
    }
}
