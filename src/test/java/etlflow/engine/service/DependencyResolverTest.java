package etlflow.engine.service;

import etlflow.engine.config.EngineConfig;
import etlflow.engine.model.ExecutionStatus;
import etlflow.engine.model.Job;
import etlflow.engine.model.JobKind;
import etlflow.engine.model.TriggerSource;
import etlflow.engine.store.Database;
import etlflow.engine.store.JdbcDependencyRepository;
import etlflow.engine.store.JdbcExecutionRepository;
import etlflow.engine.store.JdbcJobRepository;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyResolverTest {

    private static Database db;
    private static JdbcJobRepository jobs;
    private static JdbcDependencyRepository dependencies;
    private static JdbcExecutionRepository executions;
    private static DependencyResolver resolver;

    @BeforeAll
    static void setup() {
        EngineConfig config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-resolver;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        jobs = new JdbcJobRepository(db);
        dependencies = new JdbcDependencyRepository(db);
        executions = new JdbcExecutionRepository(db);
        resolver = new DependencyResolver(dependencies, executions, jobs);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void seed() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM job_dependencies");
            st.execute("DELETE FROM job_executions");
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
        for (String id : List.of("extract", "clean", "load")) {
            jobs.save(Job.builder().id(id).name(id).kind(JobKind.SHELL).command("true").build());
        }
        dependencies.add("load", "extract");
        dependencies.add("load", "clean");
    }

    private void finishedRun(String jobId, ExecutionStatus status) {
        long id = executions.create(jobId, TriggerSource.SCHEDULER);
        executions.finish(id, status, status == ExecutionStatus.COMPLETED ? 0 : 1, "", "", 0);
    }

    @Test
    void jobWithoutPrerequisitesIsSatisfied() {
        assertTrue(resolver.dependenciesSatisfied("extract"));
        assertTrue(resolver.unmetPrerequisites("extract").isEmpty());
    }

    @Test
    void neverRunPrerequisiteBlocks() {
        finishedRun("extract", ExecutionStatus.COMPLETED);

        assertFalse(resolver.dependenciesSatisfied("load"));
        assertEquals(List.of("clean"), resolver.unmetPrerequisites("load"));
    }

    @Test
    void runningPrerequisiteBlocks() {
        finishedRun("extract", ExecutionStatus.COMPLETED);
        finishedRun("clean", ExecutionStatus.COMPLETED);
        executions.create("clean", TriggerSource.MANUAL);

        assertFalse(resolver.dependenciesSatisfied("load"));
    }

    @Test
    void latestFailureBlocksEvenAfterEarlierSuccess() {
        finishedRun("extract", ExecutionStatus.COMPLETED);
        finishedRun("clean", ExecutionStatus.COMPLETED);
        finishedRun("clean", ExecutionStatus.FAILED);

        assertFalse(resolver.dependenciesSatisfied("load"));
        assertEquals(List.of("clean"), resolver.unmetPrerequisites("load"));
    }

    @Test
    void allLatestCompletedSatisfies() {
        finishedRun("extract", ExecutionStatus.FAILED);
        finishedRun("extract", ExecutionStatus.COMPLETED);
        finishedRun("clean", ExecutionStatus.COMPLETED);

        assertTrue(resolver.dependenciesSatisfied("load"));
    }

    @Test
    void checkIsOneLevelDeep() {
        dependencies.add("extract", "clean");
        finishedRun("extract", ExecutionStatus.COMPLETED);

        // clean never ran, which blocks extract but is only seen directly by load
        assertFalse(resolver.dependenciesSatisfied("extract"));
        dependencies.remove("load", "clean");
        assertTrue(resolver.dependenciesSatisfied("load"));
    }
}
