package etlflow.engine.execution;

import etlflow.engine.config.EngineConfig;
import etlflow.engine.model.Execution;
import etlflow.engine.model.ExecutionStatus;
import etlflow.engine.model.Job;
import etlflow.engine.model.JobKind;
import etlflow.engine.model.JobStatus;
import etlflow.engine.model.TriggerSource;
import etlflow.engine.notify.Notification;
import etlflow.engine.notify.NotificationDispatcher;
import etlflow.engine.notify.NotifyResult;
import etlflow.engine.notify.WebhookNotifier;
import etlflow.engine.store.Database;
import etlflow.engine.store.JdbcExecutionRepository;
import etlflow.engine.store.JdbcJobRepository;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ExecutionEngineTest {

    private static Database db;
    private static JdbcJobRepository jobs;
    private static JdbcExecutionRepository executions;
    private static ProcessRunner runner;
    private static StatusBus statusBus;
    private static NotificationDispatcher dispatcher;
    private static final BlockingQueue<Notification> notifications = new LinkedBlockingQueue<>();

    private ExecutionEngine engine;

    @BeforeAll
    static void setup() {
        EngineConfig config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-engine;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        jobs = new JdbcJobRepository(db);
        executions = new JdbcExecutionRepository(db);
        runner = new ProcessRunner("python3");
        statusBus = new StatusBus();
        dispatcher = new NotificationDispatcher(null, new WebhookNotifier(), null, notification -> {
            notifications.add(notification);
            return NotifyResult.ok();
        });
    }

    @AfterAll
    static void teardown() {
        dispatcher.close();
        statusBus.close();
        runner.close();
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        notifications.clear();
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM job_dependencies");
            st.execute("DELETE FROM job_executions");
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
        engine = new ExecutionEngine(jobs, executions, runner, statusBus, dispatcher, 5);
    }

    @AfterEach
    void closeEngine() {
        engine.close();
    }

    private static Job save(String id, String command, Job.Builder builder) {
        Job job = builder.id(id).name(id).kind(JobKind.SHELL).command(command).retryDelaySeconds(0).build();
        jobs.save(job);
        return job;
    }

    private static Job save(String id, String command) {
        return save(id, command, Job.builder());
    }

    @Test
    void successfulRunIsRecorded() {
        save("hello", "echo hello");

        long id = engine.execute("hello", TriggerSource.MANUAL).orElseThrow();

        Execution execution = executions.findById(id).orElseThrow();
        assertEquals(ExecutionStatus.COMPLETED, execution.status());
        assertEquals(0, execution.exitCode());
        assertEquals("hello\n", execution.output());
        assertEquals(0, execution.retryCount());
        assertEquals(TriggerSource.MANUAL, execution.triggeredBy());
        assertNotNull(execution.endTime());

        Job job = jobs.findById("hello").orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.status());
        assertNotNull(job.lastRun());
        assertFalse(engine.isRunning("hello"));
    }

    @Test
    @DisplayName("maxRetries=2 on an always-failing job gives 3 attempts and one FAILED record")
    void retriesAreCountedInOneRecord(@TempDir Path dir) throws Exception {
        Path attempts = dir.resolve("attempts");
        save("flaky", "echo try >> " + attempts + "; exit 3", Job.builder().maxRetries(2));

        long id = engine.execute("flaky", TriggerSource.SCHEDULER).orElseThrow();

        assertEquals(3, Files.readAllLines(attempts).size());
        List<Execution> history = executions.findByJobId("flaky", 10);
        assertEquals(1, history.size());
        Execution execution = history.get(0);
        assertEquals(id, execution.id());
        assertEquals(ExecutionStatus.FAILED, execution.status());
        assertEquals(3, execution.exitCode());
        assertEquals(2, execution.retryCount());
        assertEquals(JobStatus.FAILED, jobs.findById("flaky").orElseThrow().status());
    }

    @Test
    @DisplayName("retry delay is waited between attempts, not before the first one")
    void retryDelayIsAppliedBetweenAttempts(@TempDir Path dir) throws Exception {
        Path attempts = dir.resolve("attempts");
        jobs.save(Job.builder().id("slow-retry").name("slow-retry").kind(JobKind.SHELL)
                .command("echo try >> " + attempts + "; exit 1")
                .maxRetries(1).retryDelaySeconds(1).build());

        long started = System.nanoTime();
        long id = engine.execute("slow-retry", TriggerSource.MANUAL).orElseThrow();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(2, Files.readAllLines(attempts).size());
        // One delay of 1s, not two
        assertTrue(elapsedMillis >= 1000, "elapsed " + elapsedMillis + "ms");
        assertTrue(elapsedMillis < 2000, "elapsed " + elapsedMillis + "ms");
        assertEquals(1, executions.findById(id).orElseThrow().retryCount());
    }

    @Test
    void retryStopsAtFirstSuccess(@TempDir Path dir) {
        Path marker = dir.resolve("marker");
        // Fails once, then succeeds because the marker exists
        save("second-time", "if [ -f " + marker + " ]; then echo ok; else touch " + marker + "; exit 1; fi",
                Job.builder().maxRetries(5));

        long id = engine.execute("second-time", TriggerSource.SCHEDULER).orElseThrow();

        Execution execution = executions.findById(id).orElseThrow();
        assertEquals(ExecutionStatus.COMPLETED, execution.status());
        assertEquals(1, execution.retryCount());
        assertEquals("ok\n", execution.output());
    }

    @Test
    void timeoutFailsTheRun() {
        save("slow", "sleep 5", Job.builder().timeoutSeconds(1));

        long id = engine.execute("slow", TriggerSource.MANUAL).orElseThrow();

        Execution execution = executions.findById(id).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, execution.status());
        assertEquals(1, execution.exitCode());
        assertTrue(execution.errorOutput().contains("timed out"));
    }

    @Test
    void unparseableEnvironmentIsIgnored() {
        save("lenient", "echo \"[$STAGE]\"", Job.builder().environment("{STAGE: prod"));

        long id = engine.execute("lenient", TriggerSource.MANUAL).orElseThrow();

        Execution execution = executions.findById(id).orElseThrow();
        assertEquals(ExecutionStatus.COMPLETED, execution.status());
        assertEquals("[]\n", execution.output());
    }

    @Test
    void missingJobIsIgnored() {
        assertTrue(engine.execute("ghost", TriggerSource.MANUAL).isEmpty());
        assertFalse(engine.isRunning("ghost"));
    }

    @Test
    @DisplayName("A second dispatch of a running job creates no record")
    void runningJobIsNotDispatchedTwice() throws Exception {
        save("long", "sleep 1");

        Future<Optional<Long>> first = engine.submit("long", TriggerSource.SCHEDULER);
        Future<Optional<Long>> second = engine.runNow("long");
        Optional<Long> direct = engine.execute("long", TriggerSource.MANUAL);

        assertTrue(second.get().isEmpty());
        assertTrue(direct.isEmpty());
        assertTrue(first.get(10, TimeUnit.SECONDS).isPresent());
        assertEquals(1, executions.findByJobId("long", 10).size());
        assertFalse(engine.isRunning("long"));
    }

    @Test
    void concurrentExecuteCallsProduceOneRecord() throws Exception {
        save("contended", "sleep 1");
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Optional<Long>>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    go.await();
                    return engine.execute("contended", TriggerSource.SCHEDULER);
                }));
            }
            go.countDown();

            int ran = 0;
            for (Future<Optional<Long>> result : results) {
                if (result.get(10, TimeUnit.SECONDS).isPresent()) {
                    ran++;
                }
            }
            assertEquals(1, ran);
            assertEquals(1, executions.findByJobId("contended", 10).size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrencyCapQueuesExtraJobs() throws Exception {
        engine.close();
        engine = new ExecutionEngine(jobs, executions, runner, statusBus, dispatcher, 1);
        save("first", "sleep 2");
        save("second", "echo second");

        Future<Optional<Long>> first = engine.submit("first", TriggerSource.SCHEDULER);
        long deadline = System.currentTimeMillis() + 5000;
        while (executions.findLatestByJobId("first").isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        Future<Optional<Long>> second = engine.submit("second", TriggerSource.SCHEDULER);
        Thread.sleep(300);

        // Waiting for the only slot, but already registered
        assertTrue(engine.isRunning("second"));
        assertTrue(executions.findLatestByJobId("second").isEmpty());
        assertTrue(engine.submit("second", TriggerSource.SCHEDULER).get().isEmpty());

        assertTrue(first.get(10, TimeUnit.SECONDS).isPresent());
        assertTrue(second.get(10, TimeUnit.SECONDS).isPresent());
        assertEquals(ExecutionStatus.COMPLETED, executions.findLatestByJobId("second").orElseThrow().status());
    }

    @Test
    void statusListenersSeeStartAndEnd() throws Exception {
        save("observed", "echo out; echo problem 1>&2; exit 1");
        BlockingQueue<String> events = new LinkedBlockingQueue<>();
        StatusListener listener = (jobId, status, output) -> events.add(jobId + ":" + status + ":" + output);
        statusBus.subscribe(listener);
        try {
            engine.execute("observed", TriggerSource.MANUAL);

            assertEquals("observed:RUNNING:null", events.poll(5, TimeUnit.SECONDS));
            assertEquals("observed:FAILED:out\n\n\nERROR OUTPUT:\nproblem\n", events.poll(5, TimeUnit.SECONDS));
        } finally {
            statusBus.unsubscribe(listener);
        }
    }

    @Test
    void failureNotifiesTarget() throws Exception {
        save("alerting", "echo broke 1>&2; exit 2", Job.builder().notificationTarget("ops-channel"));
        save("quiet", "exit 2");

        engine.execute("quiet", TriggerSource.MANUAL);
        engine.execute("alerting", TriggerSource.MANUAL);

        Notification notification = notifications.poll(5, TimeUnit.SECONDS);
        assertNotNull(notification);
        assertEquals("alerting", notification.jobName());
        assertEquals("ops-channel", notification.target());
        assertFalse(notification.success());
        assertEquals("broke\n", notification.errorOutput());
        assertNull(notifications.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void successNotifiesOnlyWhenAsked() throws Exception {
        save("silent", "true", Job.builder().notificationTarget("ops-channel"));
        save("chatty", "true", Job.builder().notificationTarget("ops-channel").notifyOnSuccess(true));

        engine.execute("silent", TriggerSource.MANUAL);
        engine.execute("chatty", TriggerSource.MANUAL);

        Notification notification = notifications.poll(5, TimeUnit.SECONDS);
        assertNotNull(notification);
        assertEquals("chatty", notification.jobName());
        assertTrue(notification.success());
        assertNull(notifications.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("a store error after the record is created still closes the record as FAILED")
    void storeErrorMidRunClosesTheRecord() throws Exception {
        JdbcJobRepository failingJobs = new JdbcJobRepository(db) {
            @Override
            public boolean updateStatus(String jobId, JobStatus status) {
                if (status == JobStatus.RUNNING) {
                    throw new RuntimeException("Failed to update job status");
                }
                return super.updateStatus(jobId, status);
            }
        };
        save("fragile", "echo never", Job.builder().notificationTarget("ops-channel"));
        ExecutionEngine fragileEngine = new ExecutionEngine(failingJobs, executions, runner, statusBus, dispatcher, 1);
        try {
            Optional<Long> id = fragileEngine.execute("fragile", TriggerSource.SCHEDULER);

            assertTrue(id.isPresent());
            List<Execution> history = executions.findByJobId("fragile", 10);
            assertEquals(1, history.size());
            Execution execution = history.get(0);
            assertEquals(ExecutionStatus.FAILED, execution.status());
            assertNotNull(execution.endTime());
            assertEquals(1, execution.exitCode());
            assertTrue(execution.errorOutput().contains("Execution error: Failed to update job status"));
            assertEquals(JobStatus.FAILED, jobs.findById("fragile").orElseThrow().status());
            assertFalse(fragileEngine.isRunning("fragile"));

            Notification notification = notifications.poll(5, TimeUnit.SECONDS);
            assertNotNull(notification);
            assertFalse(notification.success());
        } finally {
            fragileEngine.close();
        }
    }

    @Test
    void notificationIsSentBeforeFinalStatusIsPublished() throws Exception {
        AtomicBoolean notified = new AtomicBoolean();
        NotificationDispatcher marking = new NotificationDispatcher(null, null, null, n -> NotifyResult.ok()) {
            @Override
            public void notifyFinished(Job job, boolean success, String output, String errorOutput) {
                notified.set(true);
            }
        };
        save("ordered", "exit 1", Job.builder().notificationTarget("ops-channel"));
        BlockingQueue<Boolean> notifiedAtFinalStatus = new LinkedBlockingQueue<>();
        StatusListener listener = (jobId, status, output) -> {
            if (status == JobStatus.FAILED) {
                notifiedAtFinalStatus.add(notified.get());
            }
        };
        ExecutionEngine orderedEngine = new ExecutionEngine(jobs, executions, runner, statusBus, marking, 1);
        statusBus.subscribe(listener);
        try {
            orderedEngine.execute("ordered", TriggerSource.MANUAL);

            assertEquals(Boolean.TRUE, notifiedAtFinalStatus.poll(5, TimeUnit.SECONDS));
        } finally {
            statusBus.unsubscribe(listener);
            orderedEngine.close();
            marking.close();
        }
    }

    @Test
    void combinedOutputAppendsErrorSection() {
        assertEquals("out", ExecutionEngine.combinedOutput(new ProcessResult("out", "", 0, false)));
        assertEquals("out\n\nERROR OUTPUT:\nerr",
                ExecutionEngine.combinedOutput(new ProcessResult("out", "err", 1, false)));
    }
}
