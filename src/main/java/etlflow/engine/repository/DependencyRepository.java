package etlflow.engine.repository;

import etlflow.engine.model.Job;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Repository interface for "job depends on prerequisite" edges.
 */
public interface DependencyRepository {

    /**
     * Add an edge. A duplicate pair is rejected by the store and reported as false.
     *
     * @param jobId          the dependent job
     * @param prerequisiteId the job that must complete first
     * @return true if a new edge was inserted
     */
    boolean add(String jobId, String prerequisiteId);

    /**
     * @return true if an edge was removed
     */
    boolean remove(String jobId, String prerequisiteId);

    /**
     * IDs of the jobs the given job depends on.
     */
    List<String> findPrerequisites(String jobId);

    /**
     * Jobs that depend on the given job, ordered by name.
     */
    List<Job> findDependents(String jobId);

    /**
     * Whole dependency graph as job ID to prerequisite IDs.
     */
    Map<String, Set<String>> findAll();
}
