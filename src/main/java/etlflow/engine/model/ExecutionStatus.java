package etlflow.engine.model;

/**
 * Status of a single execution record.
 * RUNNING is the only non-terminal state.
 */
public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /** Job status mirrored onto the job definition when an execution reaches this state */
    public JobStatus toJobStatus() {
        return switch (this) {
            case RUNNING -> JobStatus.RUNNING;
            case COMPLETED -> JobStatus.COMPLETED;
            case FAILED -> JobStatus.FAILED;
        };
    }
}
