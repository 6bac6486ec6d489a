package etlflow.engine.service;

import etlflow.engine.config.EngineConfig;
import etlflow.engine.execution.RecordingExecutionEngine;
import etlflow.engine.model.ExecutionStatus;
import etlflow.engine.model.Job;
import etlflow.engine.model.JobKind;
import etlflow.engine.model.JobStatus;
import etlflow.engine.model.ScheduleKind;
import etlflow.engine.model.TriggerSource;
import etlflow.engine.store.Database;
import etlflow.engine.store.JdbcDependencyRepository;
import etlflow.engine.store.JdbcExecutionRepository;
import etlflow.engine.store.JdbcJobRepository;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    private static Database db;
    private static JdbcJobRepository jobRepository;
    private static JdbcDependencyRepository dependencyRepository;
    private static JdbcExecutionRepository executionRepository;
    private static RecordingExecutionEngine engine;
    private static JobService service;

    @BeforeAll
    static void setup() {
        EngineConfig config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-job-service;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        jobRepository = new JdbcJobRepository(db);
        dependencyRepository = new JdbcDependencyRepository(db);
        executionRepository = new JdbcExecutionRepository(db);
        engine = new RecordingExecutionEngine();
        DependencyResolver resolver = new DependencyResolver(dependencyRepository, executionRepository, jobRepository);
        service = new JobService(jobRepository, dependencyRepository, executionRepository, resolver, engine);
    }

    @AfterAll
    static void teardown() {
        engine.close();
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        engine.clear();
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM job_dependencies");
            st.execute("DELETE FROM job_executions");
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
    }

    private static Job.Builder definition(String name) {
        return Job.builder()
                .id("new")
                .name(name)
                .kind(JobKind.SHELL)
                .command("echo " + name);
    }

    @Test
    void createAssignsIdAndResetsRuntimeState() {
        Job created = service.create(definition("  extract  ")
                .status(JobStatus.FAILED)
                .scheduleKind(ScheduleKind.INTERVAL)
                .intervalMinutes(5)
                .cronExpression("ignored")
                .build());

        assertNotEquals("new", created.id());
        assertEquals("extract", created.name());
        assertEquals(JobStatus.IDLE, created.status());
        assertNull(created.cronExpression());
        assertNull(created.lastRun());
        assertEquals(created, service.findByName("extract").orElseThrow());
    }

    @Test
    void createRejectsDuplicateName() {
        service.create(definition("extract").build());

        InvalidJobException e = assertThrows(InvalidJobException.class,
                () -> service.create(definition("extract").build()));
        assertTrue(e.getMessage().contains("already exists"));
    }

    @Test
    void createRejectsInvalidDefinitions() {
        assertThrows(InvalidJobException.class, () -> service.create(definition(" ").build()));
        assertThrows(InvalidJobException.class, () -> service.create(definition("a").command("  ").build()));
        assertThrows(InvalidJobException.class, () -> service.create(definition("b").maxRetries(-1).build()));
        assertThrows(InvalidJobException.class, () -> service.create(definition("c").timeoutSeconds(0).build()));
        assertThrows(InvalidJobException.class,
                () -> service.create(definition("d").scheduleKind(ScheduleKind.INTERVAL).build()));
        assertThrows(InvalidJobException.class, () -> service.create(
                definition("e").scheduleKind(ScheduleKind.CRON).cronExpression("every day").build()));
        assertThrows(InvalidJobException.class,
                () -> service.create(definition("f").environment("[1, 2]").build()));
        assertThrows(InvalidJobException.class,
                () -> service.create(definition("g").environment("{broken").build()));

        assertTrue(service.findAll().isEmpty());
    }

    @Test
    void createAcceptsFiveFieldCron() {
        Job job = service.create(definition("nightly")
                .scheduleKind(ScheduleKind.CRON)
                .cronExpression("30 2 * * *")
                .build());

        assertEquals("30 2 * * *", job.cronExpression());
    }

    @Test
    void updateChangesDefinition() {
        Job job = service.create(definition("extract").build());

        Job updated = service.update(job.toBuilder().command("echo v2").maxRetries(3).build());

        assertEquals("echo v2", updated.command());
        assertEquals(3, updated.maxRetries());
    }

    @Test
    void updateRejectsNameOfAnotherJob() {
        service.create(definition("extract").build());
        Job load = service.create(definition("load").build());

        assertThrows(InvalidJobException.class, () -> service.update(load.toBuilder().name("extract").build()));
    }

    @Test
    void enableAndDisable() {
        Job job = service.create(definition("extract").build());

        assertTrue(service.disable(job.id()));
        assertFalse(service.findById(job.id()).orElseThrow().enabled());
        assertTrue(service.enable(job.id()));
        assertTrue(service.findById(job.id()).orElseThrow().enabled());
    }

    @Test
    void dependencyEdges() throws Exception {
        Job extract = service.create(definition("extract").build());
        Job load = service.create(definition("load").build());

        assertTrue(service.addDependency(load.id(), extract.id()));
        assertFalse(service.addDependency(load.id(), extract.id()));

        assertEquals(List.of("extract"), service.getDependencies(load.id()).stream().map(Job::name).toList());
        assertEquals(List.of("load"), service.getDependents(extract.id()).stream().map(Job::name).toList());

        assertTrue(service.removeDependency(load.id(), extract.id()));
        assertTrue(service.getDependencies(load.id()).isEmpty());
    }

    @Test
    void selfDependencyIsRejected() {
        Job job = service.create(definition("extract").build());

        DependencyCycleException e = assertThrows(DependencyCycleException.class,
                () -> service.addDependency(job.id(), job.id()));
        assertEquals(List.of("extract", "extract"), e.cycle());
    }

    @Test
    @DisplayName("An edge closing a cycle is rejected and reports the cycle path")
    void cycleIsRejected() throws Exception {
        Job a = service.create(definition("a").build());
        Job b = service.create(definition("b").build());
        Job c = service.create(definition("c").build());
        service.addDependency(b.id(), a.id());
        service.addDependency(c.id(), b.id());

        DependencyCycleException e = assertThrows(DependencyCycleException.class,
                () -> service.addDependency(a.id(), c.id()));
        assertEquals(List.of("a", "c", "b", "a"), e.cycle());
        assertTrue(service.getDependencies(a.id()).isEmpty());
    }

    @Test
    @DisplayName("Opposite edges added concurrently never both land")
    void concurrentOppositeEdgesCannotFormACycle() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 20; round++) {
                Job a = service.create(definition("a" + round).build());
                Job b = service.create(definition("b" + round).build());
                CountDownLatch go = new CountDownLatch(1);

                Future<Boolean> forward = pool.submit(() -> addQuietly(go, a.id(), b.id()));
                Future<Boolean> backward = pool.submit(() -> addQuietly(go, b.id(), a.id()));
                go.countDown();

                assertTrue(forward.get(10, TimeUnit.SECONDS) ^ backward.get(10, TimeUnit.SECONDS),
                        "exactly one edge expected in round " + round);
                assertEquals(1, service.getDependencies(a.id()).size() + service.getDependencies(b.id()).size());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static boolean addQuietly(CountDownLatch go, String jobId, String prerequisiteId) throws Exception {
        go.await();
        try {
            return service.addDependency(jobId, prerequisiteId);
        } catch (DependencyCycleException e) {
            return false;
        }
    }

    @Test
    void diamondIsNotACycle() throws Exception {
        Job root = service.create(definition("root").build());
        Job left = service.create(definition("left").build());
        Job right = service.create(definition("right").build());
        Job sink = service.create(definition("sink").build());

        service.addDependency(left.id(), root.id());
        service.addDependency(right.id(), root.id());
        service.addDependency(sink.id(), left.id());
        assertTrue(service.addDependency(sink.id(), right.id()));
    }

    @Test
    void deleteRemovesEdgesAndHistory() throws Exception {
        Job extract = service.create(definition("extract").build());
        Job load = service.create(definition("load").build());
        service.addDependency(load.id(), extract.id());
        executionRepository.create(extract.id(), TriggerSource.MANUAL);

        assertTrue(service.delete(extract.id()));

        assertTrue(service.findById(extract.id()).isEmpty());
        assertTrue(service.getDependencies(load.id()).isEmpty());
        assertTrue(service.getExecutions(extract.id()).isEmpty());
    }

    @Test
    void executionQueries() {
        Job job = service.create(definition("extract").build());
        long first = executionRepository.create(job.id(), TriggerSource.SCHEDULER);
        executionRepository.finish(first, ExecutionStatus.FAILED, 1, "", "err", 0);
        long second = executionRepository.create(job.id(), TriggerSource.MANUAL);

        assertEquals(2, service.getExecutions(job.id()).size());
        assertEquals(1, service.getAllExecutions(ExecutionStatus.FAILED).size());
        assertEquals(2, service.getAllExecutions(null).size());
        assertEquals(ExecutionStatus.RUNNING, service.getExecution(second).orElseThrow().status());
    }

    @Test
    void checkedRunNowWaitsForPrerequisites() throws Exception {
        Job extract = service.create(definition("extract").build());
        Job load = service.create(definition("load").build());
        service.addDependency(load.id(), extract.id());

        assertFalse(service.runNowChecked(load.id()));
        assertTrue(engine.dispatches().isEmpty());

        long run = executionRepository.create(extract.id(), TriggerSource.SCHEDULER);
        executionRepository.finish(run, ExecutionStatus.COMPLETED, 0, "", "", 0);

        assertTrue(service.runNowChecked(load.id()));
        assertEquals(List.of(new RecordingExecutionEngine.Dispatch(load.id(), TriggerSource.MANUAL)),
                engine.dispatches());
    }
}
