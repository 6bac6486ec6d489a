package etlflow.engine.repository;

import etlflow.engine.model.Job;
import etlflow.engine.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for job definitions.
 */
public interface JobRepository {

    /**
     * Save a new job.
     *
     * @param job the job to save
     * @throws IllegalArgumentException if another job already uses the same name
     */
    void save(Job job);

    /**
     * Replace the definition fields of an existing job.
     * Runtime fields (status, last run, next run) are left untouched.
     *
     * @param job the updated job
     * @return true if a job with that ID existed
     */
    boolean update(Job job);

    /**
     * Delete a job together with its dependency edges and execution records.
     *
     * @param jobId the job ID
     * @return true if deleted
     */
    boolean delete(String jobId);

    Optional<Job> findById(String jobId);

    Optional<Job> findByName(String name);

    /**
     * Get all jobs ordered by name.
     */
    List<Job> findAll();

    /**
     * Get enabled jobs ordered by name.
     */
    List<Job> findEnabled();

    boolean updateStatus(String jobId, JobStatus status);

    /**
     * Record the start of a run. Clears the projected next run so that
     * the scheduler recomputes it from the new last-run timestamp.
     */
    boolean updateLastRun(String jobId, Instant lastRun);

    boolean updateNextRun(String jobId, Instant nextRun);

    boolean setEnabled(String jobId, boolean enabled);

    /**
     * Reset every RUNNING job back to IDLE. Used at startup, when no execution can be in flight.
     *
     * @return number of jobs reset
     */
    int resetRunning();

    /**
     * Generate a new unique job ID.
     *
     * @return unique ID like "job-{uuid}"
     */
    String generateId();
}
