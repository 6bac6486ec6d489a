package etlflow.engine.model;

/**
 * Who started an execution.
 */
public enum TriggerSource {
    /** Dispatched by the scheduler loop because the job was due */
    SCHEDULER,
    /** "Run now" request from an external caller */
    MANUAL
}
