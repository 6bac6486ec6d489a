package etlflow.engine.execution;

import etlflow.engine.model.JobStatus;

/**
 * Receives job status changes from the execution engine.
 * Called once with RUNNING when a run starts (output is null) and once with the final
 * status and combined output when it ends.
 */
@FunctionalInterface
public interface StatusListener {

    void onStatus(String jobId, JobStatus status, String output);
}
