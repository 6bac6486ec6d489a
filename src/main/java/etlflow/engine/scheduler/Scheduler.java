package etlflow.engine.scheduler;

import etlflow.engine.config.EngineConfig;
import etlflow.engine.execution.ExecutionEngine;
import etlflow.engine.model.Job;
import etlflow.engine.model.TriggerSource;
import etlflow.engine.repository.JobRepository;
import etlflow.engine.service.DependencyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls enabled jobs and dispatches the due ones to the execution engine.
 * <p>
 * Uses a single-threaded executor so scans never overlap. Dispatch is non-blocking: the
 * loop never waits on a job. Stopping the loop does not cancel runs already dispatched.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final JobRepository jobRepository;
    private final DependencyResolver dependencyResolver;
    private final DueEvaluator dueEvaluator;
    private final ExecutionEngine executionEngine;
    private final EngineConfig config;

    private volatile boolean running = false;

    public Scheduler(JobRepository jobRepository, DependencyResolver dependencyResolver, DueEvaluator dueEvaluator,
            ExecutionEngine executionEngine, EngineConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "etlflow-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.jobRepository = jobRepository;
        this.dependencyResolver = dependencyResolver;
        this.dueEvaluator = dueEvaluator;
        this.executionEngine = executionEngine;
        this.config = config;
    }

    /**
     * Start polling. The first scan runs immediately.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long pollIntervalMs = config.pollInterval().toMillis();
        executor.scheduleWithFixedDelay(
                wrapRunnable("job-scan", this::pollOnce),
                0,
                pollIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Scheduler started, polling every {}ms", pollIntervalMs);
    }

    /**
     * Stop polling and wait for the current scan to finish.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Scan enabled jobs once and dispatch the due ones.
     *
     * @return number of jobs dispatched
     */
    public int pollOnce() {
        List<Job> jobs = jobRepository.findEnabled();
        int dispatched = 0;

        for (Job job : jobs) {
            if (executionEngine.isRunning(job.id())) {
                continue;
            }
            try {
                if (!dueEvaluator.isDue(job)) {
                    continue;
                }
                // Checked right before dispatch, never cached across scans
                List<String> unmet = dependencyResolver.unmetPrerequisites(job.id());
                if (!unmet.isEmpty()) {
                    log.info("Job {} is due but waits on {}", job.name(), unmet);
                    continue;
                }
                executionEngine.submit(job.id(), TriggerSource.SCHEDULER);
                dispatched++;
            } catch (Exception e) {
                log.error("Failed to evaluate job {}", job.name(), e);
            }
        }

        if (dispatched > 0) {
            log.debug("Scan dispatched {} of {} enabled jobs", dispatched, jobs.size());
        }
        return dispatched;
    }

    /**
     * Wrap a runnable with error handling so one failed scan does not cancel the schedule.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
