package etlflow.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import etlflow.engine.execution.ExecutionEngine;
import etlflow.engine.model.Execution;
import etlflow.engine.model.ExecutionStatus;
import etlflow.engine.model.Job;
import etlflow.engine.model.JobStatus;
import etlflow.engine.model.ScheduleKind;
import etlflow.engine.model.TriggerSource;
import etlflow.engine.repository.DependencyRepository;
import etlflow.engine.repository.ExecutionRepository;
import etlflow.engine.repository.JobRepository;
import etlflow.engine.scheduler.CronSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Business logic for job definitions: validation, CRUD, dependency edges and manual runs.
 * This is the entry point for the job editor and import layers; the scheduler and the
 * execution engine talk to the repositories directly.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JobRepository jobRepository;
    private final DependencyRepository dependencyRepository;
    private final ExecutionRepository executionRepository;
    private final DependencyResolver dependencyResolver;
    private final ExecutionEngine executionEngine;

    public JobService(JobRepository jobRepository, DependencyRepository dependencyRepository,
            ExecutionRepository executionRepository, DependencyResolver dependencyResolver,
            ExecutionEngine executionEngine) {
        this.jobRepository = jobRepository;
        this.dependencyRepository = dependencyRepository;
        this.executionRepository = executionRepository;
        this.dependencyResolver = dependencyResolver;
        this.executionEngine = executionEngine;
    }

    /**
     * Validate and persist a new job. Any ID and runtime state on the given job are
     * discarded: the job gets a fresh ID and starts IDLE with no run history.
     *
     * @return the stored job
     * @throws InvalidJobException if the definition is invalid or the name is taken
     */
    public Job create(Job definition) {
        validate(definition);

        if (jobRepository.findByName(definition.name().trim()).isPresent()) {
            throw new InvalidJobException("Job name already exists: " + definition.name().trim());
        }

        Job job = normalize(definition).toBuilder()
                .id(jobRepository.generateId())
                .status(JobStatus.IDLE)
                .lastRun(null)
                .nextRun(null)
                .createdAt(Instant.now())
                .build();

        jobRepository.save(job);
        log.info("Created job {} ({}) schedule={}", job.name(), job.id(), job.scheduleKind());
        return job;
    }

    /**
     * Replace the definition of an existing job.
     *
     * @return the stored job
     * @throws InvalidJobException if the definition is invalid or the job does not exist
     */
    public Job update(Job definition) {
        validate(definition);

        Optional<Job> sameName = jobRepository.findByName(definition.name().trim());
        if (sameName.isPresent() && !sameName.get().id().equals(definition.id())) {
            throw new InvalidJobException("Job name already exists: " + definition.name().trim());
        }

        if (!jobRepository.update(normalize(definition))) {
            throw new InvalidJobException("Job not found: " + definition.id());
        }
        log.info("Updated job {} ({})", definition.name(), definition.id());
        return jobRepository.findById(definition.id()).orElseThrow();
    }

    /**
     * Delete a job, its dependency edges and its execution history.
     */
    public boolean delete(String jobId) {
        boolean deleted = jobRepository.delete(jobId);
        if (deleted) {
            log.info("Deleted job {}", jobId);
        }
        return deleted;
    }

    public Optional<Job> findById(String jobId) {
        return jobRepository.findById(jobId);
    }

    public Optional<Job> findByName(String name) {
        return jobRepository.findByName(name);
    }

    public List<Job> findAll() {
        return jobRepository.findAll();
    }

    public boolean enable(String jobId) {
        return jobRepository.setEnabled(jobId, true);
    }

    public boolean disable(String jobId) {
        return jobRepository.setEnabled(jobId, false);
    }

    // --- Dependencies ---

    /**
     * Make {@code jobId} depend on {@code prerequisiteId}.
     * Check and insert are serialized so two opposite edges cannot both pass the check.
     *
     * @return false if the edge already existed
     * @throws DependencyCycleException if the edge would close a cycle (including a self edge)
     */
    public synchronized boolean addDependency(String jobId, String prerequisiteId) throws DependencyCycleException {
        if (jobId.equals(prerequisiteId)) {
            String name = nameOf(jobId);
            throw new DependencyCycleException("Job cannot depend on itself: " + name, List.of(name, name));
        }

        Map<String, Set<String>> graph = dependencyRepository.findAll();
        // The new edge jobId -> prerequisiteId closes a cycle iff prerequisiteId already reaches jobId
        List<String> path = findPath(graph, prerequisiteId, jobId);
        if (!path.isEmpty()) {
            List<String> cycle = new ArrayList<>();
            cycle.add(nameOf(jobId));
            for (String id : path) {
                cycle.add(nameOf(id));
            }
            throw new DependencyCycleException("Dependency would create a cycle: " + String.join(" -> ", cycle),
                    cycle);
        }

        boolean added = dependencyRepository.add(jobId, prerequisiteId);
        if (added) {
            log.info("Job {} now depends on {}", nameOf(jobId), nameOf(prerequisiteId));
        }
        return added;
    }

    public boolean removeDependency(String jobId, String prerequisiteId) {
        return dependencyRepository.remove(jobId, prerequisiteId);
    }

    public List<Job> getDependencies(String jobId) {
        List<Job> prerequisites = new ArrayList<>();
        for (String id : dependencyRepository.findPrerequisites(jobId)) {
            jobRepository.findById(id).ifPresent(prerequisites::add);
        }
        return prerequisites;
    }

    public List<Job> getDependents(String jobId) {
        return dependencyRepository.findDependents(jobId);
    }

    // --- Executions ---

    public List<Execution> getExecutions(String jobId) {
        return executionRepository.findByJobId(jobId, ExecutionRepository.DEFAULT_JOB_LIMIT);
    }

    public List<Execution> getAllExecutions(ExecutionStatus statusFilter) {
        return executionRepository.findAll(ExecutionRepository.DEFAULT_ALL_LIMIT, statusFilter);
    }

    public Optional<Execution> getExecution(long executionId) {
        return executionRepository.findById(executionId);
    }

    /**
     * "Run now" honoring dependencies: dispatches only when every prerequisite's latest
     * execution completed. {@link ExecutionEngine#runNow(String)} bypasses that check.
     *
     * @return true if the job was dispatched
     */
    public boolean runNowChecked(String jobId) {
        List<String> unmet = dependencyResolver.unmetPrerequisites(jobId);
        if (!unmet.isEmpty()) {
            log.info("Not running {}: dependencies not met {}", nameOf(jobId), unmet);
            return false;
        }
        executionEngine.submit(jobId, TriggerSource.MANUAL);
        return true;
    }

    // --- Validation ---

    private void validate(Job job) {
        if (job.name() == null || job.name().isBlank()) {
            throw new InvalidJobException("Job name is required");
        }
        if (job.command() == null || job.command().isBlank()) {
            throw new InvalidJobException("Command/script is required");
        }
        if (job.maxRetries() < 0) {
            throw new InvalidJobException("Max retries must not be negative");
        }
        if (job.retryDelaySeconds() < 0) {
            throw new InvalidJobException("Retry delay must not be negative");
        }
        if (job.timeoutSeconds() != null && job.timeoutSeconds() <= 0) {
            throw new InvalidJobException("Timeout must be a positive number of seconds");
        }

        if (job.scheduleKind() == ScheduleKind.INTERVAL
                && (job.intervalMinutes() == null || job.intervalMinutes() <= 0)) {
            throw new InvalidJobException("Interval must be a positive number of minutes");
        }
        if (job.scheduleKind() == ScheduleKind.CRON) {
            try {
                CronSchedule.parse(job.cronExpression());
            } catch (IllegalArgumentException e) {
                throw new InvalidJobException("Invalid cron expression: " + e.getMessage(), e);
            }
        }

        if (job.environment() != null && !job.environment().isBlank()) {
            try {
                JsonNode env = MAPPER.readTree(job.environment());
                if (!env.isObject()) {
                    throw new InvalidJobException("Environment variables must be a JSON object");
                }
            } catch (JsonProcessingException e) {
                throw new InvalidJobException("Environment variables must be valid JSON", e);
            }
        }
    }

    /** Trim text fields and drop schedule parameters that do not apply to the schedule kind */
    private Job normalize(Job job) {
        return job.toBuilder()
                .name(job.name().trim())
                .command(job.command().trim())
                .workingDirectory(blankToNull(job.workingDirectory()))
                .environment(blankToNull(job.environment()))
                .notificationTarget(blankToNull(job.notificationTarget()))
                .intervalMinutes(job.scheduleKind() == ScheduleKind.INTERVAL ? job.intervalMinutes() : null)
                .cronExpression(job.scheduleKind() == ScheduleKind.CRON ? job.cronExpression().trim() : null)
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private String nameOf(String jobId) {
        return jobRepository.findById(jobId).map(Job::name).orElse(jobId);
    }

    /** Depth-first search for a path from -> to over prerequisite edges; empty if none */
    private static List<String> findPath(Map<String, Set<String>> graph, String from, String to) {
        Deque<List<String>> stack = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        stack.push(List.of(from));

        while (!stack.isEmpty()) {
            List<String> path = stack.pop();
            String node = path.get(path.size() - 1);
            if (node.equals(to)) {
                return path;
            }
            if (!visited.add(node)) {
                continue;
            }
            for (String next : graph.getOrDefault(node, Collections.emptySet())) {
                if (!visited.contains(next)) {
                    List<String> extended = new ArrayList<>(path);
                    extended.add(next);
                    stack.push(extended);
                }
            }
        }
        return List.of();
    }
}
