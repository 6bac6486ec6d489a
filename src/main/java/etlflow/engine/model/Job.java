package etlflow.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable job definition: a named command body plus its schedule and run policy.
 */
public final class Job {
    private final String id;
    private final String name;
    private final String description;
    private final JobKind kind;
    private final String command;
    private final String workingDirectory;
    private final String environment; // JSON object text, parsed leniently at run time
    private final ScheduleKind scheduleKind;
    private final Integer intervalMinutes;
    private final String cronExpression;
    private final boolean enabled;
    private final JobStatus status;
    private final Instant lastRun;
    private final Instant nextRun;
    private final int maxRetries;
    private final int retryDelaySeconds;
    private final Integer timeoutSeconds;
    private final String notificationTarget;
    private final boolean notifyOnSuccess;
    private final boolean notifyOnFailure;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.description = builder.description;
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.command = Objects.requireNonNull(builder.command, "command is required");
        this.workingDirectory = builder.workingDirectory;
        this.environment = builder.environment;
        this.scheduleKind = Objects.requireNonNull(builder.scheduleKind, "scheduleKind is required");
        this.intervalMinutes = builder.intervalMinutes;
        this.cronExpression = builder.cronExpression;
        this.enabled = builder.enabled;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.lastRun = builder.lastRun;
        this.nextRun = builder.nextRun;
        this.maxRetries = builder.maxRetries;
        this.retryDelaySeconds = builder.retryDelaySeconds;
        this.timeoutSeconds = builder.timeoutSeconds;
        this.notificationTarget = builder.notificationTarget;
        this.notifyOnSuccess = builder.notifyOnSuccess;
        this.notifyOnFailure = builder.notifyOnFailure;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public JobKind kind() {
        return kind;
    }

    public String command() {
        return command;
    }

    public String workingDirectory() {
        return workingDirectory;
    }

    public String environment() {
        return environment;
    }

    public ScheduleKind scheduleKind() {
        return scheduleKind;
    }

    public Integer intervalMinutes() {
        return intervalMinutes;
    }

    public String cronExpression() {
        return cronExpression;
    }

    public boolean enabled() {
        return enabled;
    }

    public JobStatus status() {
        return status;
    }

    public Instant lastRun() {
        return lastRun;
    }

    public Instant nextRun() {
        return nextRun;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public int retryDelaySeconds() {
        return retryDelaySeconds;
    }

    public Integer timeoutSeconds() {
        return timeoutSeconds;
    }

    public String notificationTarget() {
        return notificationTarget;
    }

    public boolean notifyOnSuccess() {
        return notifyOnSuccess;
    }

    public boolean notifyOnFailure() {
        return notifyOnFailure;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public boolean hasNotificationTarget() {
        return notificationTarget != null && !notificationTarget.isBlank();
    }

    /** Whether an execution with the given outcome should trigger a notification */
    public boolean shouldNotify(boolean success) {
        if (!hasNotificationTarget()) {
            return false;
        }
        return success ? notifyOnSuccess : notifyOnFailure;
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .kind(kind)
                .command(command)
                .workingDirectory(workingDirectory)
                .environment(environment)
                .scheduleKind(scheduleKind)
                .intervalMinutes(intervalMinutes)
                .cronExpression(cronExpression)
                .enabled(enabled)
                .status(status)
                .lastRun(lastRun)
                .nextRun(nextRun)
                .maxRetries(maxRetries)
                .retryDelaySeconds(retryDelaySeconds)
                .timeoutSeconds(timeoutSeconds)
                .notificationTarget(notificationTarget)
                .notifyOnSuccess(notifyOnSuccess)
                .notifyOnFailure(notifyOnFailure)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private JobKind kind = JobKind.SHELL;
        private String command;
        private String workingDirectory;
        private String environment;
        private ScheduleKind scheduleKind = ScheduleKind.MANUAL;
        private Integer intervalMinutes;
        private String cronExpression;
        private boolean enabled = true;
        private JobStatus status = JobStatus.IDLE;
        private Instant lastRun;
        private Instant nextRun;
        private int maxRetries = 0;
        private int retryDelaySeconds = 60;
        private Integer timeoutSeconds;
        private String notificationTarget;
        private boolean notifyOnSuccess = false;
        private boolean notifyOnFailure = true;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder kind(JobKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder workingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder scheduleKind(ScheduleKind scheduleKind) {
            this.scheduleKind = scheduleKind;
            return this;
        }

        public Builder intervalMinutes(Integer intervalMinutes) {
            this.intervalMinutes = intervalMinutes;
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder lastRun(Instant lastRun) {
            this.lastRun = lastRun;
            return this;
        }

        public Builder nextRun(Instant nextRun) {
            this.nextRun = nextRun;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelaySeconds(int retryDelaySeconds) {
            this.retryDelaySeconds = retryDelaySeconds;
            return this;
        }

        public Builder timeoutSeconds(Integer timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder notificationTarget(String notificationTarget) {
            this.notificationTarget = notificationTarget;
            return this;
        }

        public Builder notifyOnSuccess(boolean notifyOnSuccess) {
            this.notifyOnSuccess = notifyOnSuccess;
            return this;
        }

        public Builder notifyOnFailure(boolean notifyOnFailure) {
            this.notifyOnFailure = notifyOnFailure;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', name='" + name + "', schedule=" + scheduleKind + ", status=" + status + "}";
    }
}
