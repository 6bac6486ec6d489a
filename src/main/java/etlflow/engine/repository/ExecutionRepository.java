package etlflow.engine.repository;

import etlflow.engine.model.Execution;
import etlflow.engine.model.ExecutionStatus;
import etlflow.engine.model.TriggerSource;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for execution records.
 */
public interface ExecutionRepository {

    int DEFAULT_JOB_LIMIT = 50;
    int DEFAULT_ALL_LIMIT = 100;

    /**
     * Create a RUNNING execution record starting now.
     *
     * @return the new execution ID
     */
    long create(String jobId, TriggerSource triggeredBy);

    /**
     * Finalize an execution: sets end time and the outcome fields.
     *
     * @return true if the record existed and was still RUNNING
     */
    boolean finish(long executionId, ExecutionStatus status, Integer exitCode, String output, String errorOutput,
            int retryCount);

    Optional<Execution> findById(long executionId);

    /**
     * Most recent execution of a job by start time.
     */
    Optional<Execution> findLatestByJobId(String jobId);

    /**
     * Recent executions of a job, most recent first.
     */
    List<Execution> findByJobId(String jobId, int limit);

    /**
     * Recent executions across all jobs, most recent first, with job names.
     *
     * @param status optional filter, null for all
     */
    List<Execution> findAll(int limit, ExecutionStatus status);

    /**
     * Mark RUNNING records left behind by a previous process as FAILED.
     *
     * @return number of records marked
     */
    int markAbandoned(String reason);
}
