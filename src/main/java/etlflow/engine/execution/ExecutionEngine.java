package etlflow.engine.execution;

import etlflow.engine.model.ExecutionStatus;
import etlflow.engine.model.Job;
import etlflow.engine.model.JobStatus;
import etlflow.engine.model.TriggerSource;
import etlflow.engine.notify.NotificationDispatcher;
import etlflow.engine.repository.ExecutionRepository;
import etlflow.engine.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Runs jobs to completion: one execution record per run, retries and timeout per job policy.
 * <p>
 * At most one run per job ID is in flight at any time. A job ID enters the running registry
 * when it is dispatched and leaves it when its run ends, whatever the outcome. Runs beyond
 * {@code maxConcurrentJobs} wait for a free slot while staying registered, so a waiting job
 * is never dispatched twice.
 */
public class ExecutionEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);
    private static final String ERROR_SECTION = "\n\nERROR OUTPUT:\n";

    private final JobRepository jobRepository;
    private final ExecutionRepository executionRepository;
    private final ProcessRunner processRunner;
    private final StatusBus statusBus;
    private final NotificationDispatcher notifier;
    private final Semaphore slots;
    private final Set<String> running = ConcurrentHashMap.newKeySet();
    private final ExecutorService dispatch = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "etlflow-job");
        t.setDaemon(true);
        return t;
    });

    public ExecutionEngine(JobRepository jobRepository, ExecutionRepository executionRepository,
            ProcessRunner processRunner, StatusBus statusBus, NotificationDispatcher notifier,
            int maxConcurrentJobs) {
        if (maxConcurrentJobs <= 0) {
            throw new IllegalArgumentException("maxConcurrentJobs must be positive");
        }
        this.jobRepository = jobRepository;
        this.executionRepository = executionRepository;
        this.processRunner = processRunner;
        this.statusBus = statusBus;
        this.notifier = notifier;
        this.slots = new Semaphore(maxConcurrentJobs, true);
    }

    /**
     * Run the job on the calling thread.
     *
     * @return the ID of the execution record, or empty if the job was already running,
     *         does not exist, or the wait for a slot was interrupted
     */
    public Optional<Long> execute(String jobId, TriggerSource triggeredBy) {
        if (!running.add(jobId)) {
            log.debug("Job {} already running, {} trigger ignored", jobId, triggeredBy);
            return Optional.empty();
        }
        try {
            return runWithSlot(jobId, triggeredBy);
        } finally {
            running.remove(jobId);
        }
    }

    /**
     * Dispatch the job on the engine's worker pool and return immediately.
     * A job that is already running is not dispatched; the returned future then holds empty.
     */
    public Future<Optional<Long>> submit(String jobId, TriggerSource triggeredBy) {
        if (!running.add(jobId)) {
            log.debug("Job {} already running, {} trigger ignored", jobId, triggeredBy);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        try {
            return dispatch.submit(() -> {
                try {
                    return runWithSlot(jobId, triggeredBy);
                } finally {
                    running.remove(jobId);
                }
            });
        } catch (RejectedExecutionException e) {
            running.remove(jobId);
            log.warn("Engine is shut down, job {} not dispatched", jobId);
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    /**
     * "Run now" from an operator. Skips due-ness and dependency checks.
     */
    public Future<Optional<Long>> runNow(String jobId) {
        log.info("Manual run requested for job {}", jobId);
        return submit(jobId, TriggerSource.MANUAL);
    }

    public boolean isRunning(String jobId) {
        return running.contains(jobId);
    }

    /**
     * Snapshot of the job IDs currently registered as running (including those waiting for a slot).
     */
    public Set<String> runningJobs() {
        return Set.copyOf(running);
    }

    private Optional<Long> runWithSlot(String jobId, TriggerSource triggeredBy) {
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while job {} waited for a slot", jobId);
            return Optional.empty();
        }
        try {
            return runClaimed(jobId, triggeredBy);
        } catch (RuntimeException e) {
            log.error("Execution of job {} aborted", jobId, e);
            return Optional.empty();
        } finally {
            slots.release();
        }
    }

    private Optional<Long> runClaimed(String jobId, TriggerSource triggeredBy) {
        Optional<Job> found = jobRepository.findById(jobId);
        if (found.isEmpty()) {
            log.warn("Job {} not found, nothing to run", jobId);
            return Optional.empty();
        }
        Job job = found.get();

        Instant startedAt = Instant.now();
        long executionId = executionRepository.create(jobId, triggeredBy);
        int attempts = 0;
        boolean finished = false;
        try {
            jobRepository.updateStatus(jobId, JobStatus.RUNNING);
            jobRepository.updateLastRun(jobId, startedAt);
            statusBus.publish(jobId, JobStatus.RUNNING, null);
            log.info("Job {} started: execution={}, trigger={}", job.name(), executionId, triggeredBy);

            ProcessResult result;
            try {
                while (true) {
                    if (attempts > 0 && job.retryDelaySeconds() > 0) {
                        TimeUnit.SECONDS.sleep(job.retryDelaySeconds());
                    }
                    attempts++;
                    result = attempt(job);
                    if (result.succeeded() || attempts > job.maxRetries()) {
                        break;
                    }
                    log.info("Job {} attempt {} failed with exit code {}, retrying in {}s",
                            job.name(), attempts, result.exitCode(), job.retryDelaySeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result = ProcessResult.failure("Execution interrupted during retry delay");
            }

            boolean success = result.succeeded();
            ExecutionStatus finalStatus = success ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED;
            int retryCount = Math.max(0, attempts - 1);

            executionRepository.finish(executionId, finalStatus, result.exitCode(), result.output(),
                    result.errorOutput(), retryCount);
            finished = true;
            jobRepository.updateStatus(jobId, finalStatus.toJobStatus());

            if (success) {
                log.info("Job {} completed: execution={}, retries={}", job.name(), executionId, retryCount);
            } else {
                log.warn("Job {} failed: execution={}, exitCode={}, retries={}",
                        job.name(), executionId, result.exitCode(), retryCount);
            }

            notifier.notifyFinished(job, success, result.output(), result.errorOutput());
            statusBus.publish(jobId, finalStatus.toJobStatus(), combinedOutput(result));
        } catch (RuntimeException e) {
            log.error("Execution {} of job {} aborted", executionId, job.name(), e);
            if (!finished) {
                recordAbort(job, executionId, Math.max(0, attempts - 1), e);
            }
        }
        return Optional.of(executionId);
    }

    /**
     * Best-effort close of an execution whose bookkeeping failed, so the record never stays RUNNING.
     */
    private void recordAbort(Job job, long executionId, int retryCount, RuntimeException cause) {
        String message = "Execution error: " + cause.getMessage();
        try {
            executionRepository.finish(executionId, ExecutionStatus.FAILED, 1, "", message, retryCount);
        } catch (RuntimeException e) {
            log.error("Could not mark execution {} FAILED", executionId, e);
        }
        try {
            jobRepository.updateStatus(job.id(), JobStatus.FAILED);
        } catch (RuntimeException e) {
            log.warn("Could not set status of job {}: {}", job.name(), e.getMessage());
        }
        notifier.notifyFinished(job, false, "", message);
        statusBus.publish(job.id(), JobStatus.FAILED, message);
    }

    private ProcessResult attempt(Job job) {
        try {
            return processRunner.run(job);
        } catch (RuntimeException e) {
            log.error("Job {} attempt raised an error", job.name(), e);
            return ProcessResult.failure("Execution error: " + e.getMessage());
        }
    }

    static String combinedOutput(ProcessResult result) {
        String output = result.output() == null ? "" : result.output();
        String errors = result.errorOutput();
        if (errors == null || errors.isBlank()) {
            return output;
        }
        return output + ERROR_SECTION + errors;
    }

    /**
     * Stop accepting runs. In-flight runs are left to finish; the wait for them is bounded.
     */
    @Override
    public void close() {
        dispatch.shutdown();
        try {
            if (!dispatch.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} job(s) still running at shutdown: {}", running.size(), running);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
