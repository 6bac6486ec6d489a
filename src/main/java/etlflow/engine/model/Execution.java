package etlflow.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of one execution record: a run of a job including its internal retries.
 */
public final class Execution {
    private final long id;
    private final String jobId;
    private final String jobName; // populated by cross-job listings only
    private final Instant startTime;
    private final Instant endTime;
    private final ExecutionStatus status;
    private final Integer exitCode;
    private final String output;
    private final String errorOutput;
    private final int retryCount;
    private final TriggerSource triggeredBy;

    private Execution(Builder builder) {
        this.id = builder.id;
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        this.jobName = builder.jobName;
        this.startTime = Objects.requireNonNull(builder.startTime, "startTime is required");
        this.endTime = builder.endTime;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.exitCode = builder.exitCode;
        this.output = builder.output;
        this.errorOutput = builder.errorOutput;
        this.retryCount = builder.retryCount;
        this.triggeredBy = Objects.requireNonNull(builder.triggeredBy, "triggeredBy is required");
    }

    public long id() {
        return id;
    }

    public String jobId() {
        return jobId;
    }

    public String jobName() {
        return jobName;
    }

    public Instant startTime() {
        return startTime;
    }

    public Instant endTime() {
        return endTime;
    }

    public ExecutionStatus status() {
        return status;
    }

    public Integer exitCode() {
        return exitCode;
    }

    public String output() {
        return output;
    }

    public String errorOutput() {
        return errorOutput;
    }

    public int retryCount() {
        return retryCount;
    }

    public TriggerSource triggeredBy() {
        return triggeredBy;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String jobId;
        private String jobName;
        private Instant startTime;
        private Instant endTime;
        private ExecutionStatus status = ExecutionStatus.RUNNING;
        private Integer exitCode;
        private String output;
        private String errorOutput;
        private int retryCount;
        private TriggerSource triggeredBy = TriggerSource.SCHEDULER;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder jobName(String jobName) {
            this.jobName = jobName;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder exitCode(Integer exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder errorOutput(String errorOutput) {
            this.errorOutput = errorOutput;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder triggeredBy(TriggerSource triggeredBy) {
            this.triggeredBy = triggeredBy;
            return this;
        }

        public Execution build() {
            return new Execution(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Execution that))
            return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Execution{id=" + id + ", jobId='" + jobId + "', status=" + status + ", exitCode=" + exitCode + "}";
    }
}
