package etlflow.engine.model;

/**
 * Current state of a job definition, as last written by the execution engine.
 */
public enum JobStatus {
    /** Never run, or reset after a restart */
    IDLE,
    /** An execution is in progress */
    RUNNING,
    /** Last execution succeeded */
    COMPLETED,
    /** Last execution failed after exhausting its retries */
    FAILED
}
