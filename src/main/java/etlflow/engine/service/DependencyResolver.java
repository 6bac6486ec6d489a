package etlflow.engine.service;

import etlflow.engine.model.Execution;
import etlflow.engine.model.ExecutionStatus;
import etlflow.engine.model.Job;
import etlflow.engine.repository.DependencyRepository;
import etlflow.engine.repository.ExecutionRepository;
import etlflow.engine.repository.JobRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a job's prerequisites are satisfied.
 * <p>
 * A prerequisite is satisfied when its most recent execution exists and COMPLETED.
 * The check is one level deep and is never cached: callers re-evaluate it right before
 * each dispatch.
 */
public class DependencyResolver {

    private final DependencyRepository dependencyRepository;
    private final ExecutionRepository executionRepository;
    private final JobRepository jobRepository;

    public DependencyResolver(DependencyRepository dependencyRepository, ExecutionRepository executionRepository,
            JobRepository jobRepository) {
        this.dependencyRepository = dependencyRepository;
        this.executionRepository = executionRepository;
        this.jobRepository = jobRepository;
    }

    public boolean dependenciesSatisfied(String jobId) {
        for (String prerequisiteId : dependencyRepository.findPrerequisites(jobId)) {
            if (!isCompleted(prerequisiteId)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Names of the prerequisites currently blocking the job (empty when satisfied).
     * Prerequisites whose job row has vanished are reported by ID.
     */
    public List<String> unmetPrerequisites(String jobId) {
        List<String> unmet = new ArrayList<>();
        for (String prerequisiteId : dependencyRepository.findPrerequisites(jobId)) {
            if (!isCompleted(prerequisiteId)) {
                unmet.add(jobRepository.findById(prerequisiteId).map(Job::name).orElse(prerequisiteId));
            }
        }
        return unmet;
    }

    private boolean isCompleted(String prerequisiteId) {
        Optional<Execution> latest = executionRepository.findLatestByJobId(prerequisiteId);
        return latest.isPresent() && latest.get().status() == ExecutionStatus.COMPLETED;
    }
}
