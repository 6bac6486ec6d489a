package etlflow.engine.service;

import java.util.List;

/**
 * Adding a dependency edge would make the job graph cyclic.
 */
public class DependencyCycleException extends Exception {

    private final List<String> cycle;

    public DependencyCycleException(String message, List<String> cycle) {
        super(message);
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Job names along the cycle, starting and ending with the same job.
     */
    public List<String> cycle() {
        return cycle;
    }
}
