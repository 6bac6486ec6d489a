package etlflow.engine.config;

import etlflow.engine.execution.ExecutionEngine;
import etlflow.engine.execution.ProcessRunner;
import etlflow.engine.execution.StatusBus;
import etlflow.engine.notify.NotificationDispatcher;
import etlflow.engine.repository.DependencyRepository;
import etlflow.engine.repository.ExecutionRepository;
import etlflow.engine.repository.JobRepository;
import etlflow.engine.scheduler.DueEvaluator;
import etlflow.engine.scheduler.RunRecovery;
import etlflow.engine.scheduler.Scheduler;
import etlflow.engine.service.DependencyResolver;
import etlflow.engine.service.JobService;
import etlflow.engine.service.JobTransferService;
import etlflow.engine.store.Database;
import etlflow.engine.store.JdbcDependencyRepository;
import etlflow.engine.store.JdbcExecutionRepository;
import etlflow.engine.store.JdbcJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all engine components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.statusBus().subscribe(listener);
 * deps.startScheduler();
 * // ... use services ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Database database;
    private final JobRepository jobRepository;
    private final DependencyRepository dependencyRepository;
    private final ExecutionRepository executionRepository;
    private final DependencyResolver dependencyResolver;
    private final ProcessRunner processRunner;
    private final StatusBus statusBus;
    private final NotificationDispatcher notificationDispatcher;
    private final ExecutionEngine executionEngine;
    private final JobService jobService;
    private final JobTransferService jobTransferService;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(EngineConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.jobRepository = new JdbcJobRepository(database);
        this.dependencyRepository = new JdbcDependencyRepository(database);
        this.executionRepository = new JdbcExecutionRepository(database);

        // Nothing can be running yet, so any RUNNING record belongs to a dead process
        new RunRecovery(jobRepository, executionRepository).recover();

        // Execution
        this.dependencyResolver = new DependencyResolver(dependencyRepository, executionRepository, jobRepository);
        this.processRunner = new ProcessRunner(config.scriptInterpreter());
        this.statusBus = new StatusBus();
        this.notificationDispatcher = NotificationDispatcher.fromConfig(config);
        this.executionEngine = new ExecutionEngine(jobRepository, executionRepository, processRunner, statusBus,
                notificationDispatcher, config.maxConcurrentJobs());

        // Services
        this.jobService = new JobService(jobRepository, dependencyRepository, executionRepository,
                dependencyResolver, executionEngine);
        this.jobTransferService = new JobTransferService(jobService, jobRepository, dependencyRepository);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    public EngineConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public DependencyRepository dependencyRepository() {
        return dependencyRepository;
    }

    public ExecutionRepository executionRepository() {
        return executionRepository;
    }

    public DependencyResolver dependencyResolver() {
        return dependencyResolver;
    }

    public StatusBus statusBus() {
        return statusBus;
    }

    public ExecutionEngine executionEngine() {
        return executionEngine;
    }

    public JobService jobService() {
        return jobService;
    }

    public JobTransferService jobTransferService() {
        return jobTransferService;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            DueEvaluator dueEvaluator = new DueEvaluator(jobRepository, Clock.systemDefaultZone(),
                    config.cronDebounce());
            scheduler = new Scheduler(jobRepository, dependencyResolver, dueEvaluator, executionEngine, config);
        }
        return scheduler;
    }

    public void startScheduler() {
        scheduler().start();
    }

    public synchronized void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop dispatching first, then let in-flight runs record their outcome
        try {
            stopScheduler();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        closeQuietly("execution engine", executionEngine);
        closeQuietly("notifier", notificationDispatcher);
        closeQuietly("status bus", statusBus);
        closeQuietly("process runner", processRunner);
        closeQuietly("database", database);

        log.info("Dependencies closed");
    }

    private static void closeQuietly(String name, AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Error closing {}: {}", name, e.getMessage());
        }
    }
}
