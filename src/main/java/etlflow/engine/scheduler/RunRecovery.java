package etlflow.engine.scheduler;

import etlflow.engine.repository.ExecutionRepository;
import etlflow.engine.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cleans up runs left RUNNING by a process that died mid-execution.
 * <p>
 * The running registry is empty after a restart, so any RUNNING execution record in the
 * store cannot have an owner anymore. Such records are marked FAILED and the job
 * statuses are put back to IDLE. Runs once, before the scheduler starts.
 */
public class RunRecovery {

    private static final Logger log = LoggerFactory.getLogger(RunRecovery.class);
    static final String ABANDONED_MESSAGE = "\nExecution abandoned: the engine stopped while the job was running\n";

    private final JobRepository jobRepository;
    private final ExecutionRepository executionRepository;

    public RunRecovery(JobRepository jobRepository, ExecutionRepository executionRepository) {
        this.jobRepository = jobRepository;
        this.executionRepository = executionRepository;
    }

    /**
     * @return number of execution records marked FAILED
     */
    public int recover() {
        int executions = executionRepository.markAbandoned(ABANDONED_MESSAGE);
        int jobs = jobRepository.resetRunning();
        if (executions > 0 || jobs > 0) {
            log.warn("Recovered {} abandoned executions, reset {} jobs to IDLE", executions, jobs);
        } else {
            log.debug("No abandoned executions found");
        }
        return executions;
    }
}
