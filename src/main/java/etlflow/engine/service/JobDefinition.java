package etlflow.engine.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import etlflow.engine.model.Job;
import etlflow.engine.model.JobKind;
import etlflow.engine.model.ScheduleKind;

import java.util.List;

/**
 * One job in an exported job file.
 * Identity and runtime state (status, last/next run) are not part of the format; unknown
 * fields such as {@code id} are ignored on import so that every import creates new jobs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("job_type") String jobType,
        @JsonProperty("command") String command,
        @JsonProperty("working_directory") String workingDirectory,
        @JsonProperty("environment_vars") JsonNode environmentVars,
        @JsonProperty("schedule_type") String scheduleType,
        @JsonProperty("interval_minutes") Integer intervalMinutes,
        @JsonProperty("cron_expression") String cronExpression,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("max_retries") Integer maxRetries,
        @JsonProperty("retry_delay_seconds") Integer retryDelaySeconds,
        @JsonProperty("timeout_seconds") Integer timeoutSeconds,
        @JsonProperty("notification_email") String notificationTarget,
        @JsonProperty("notify_on_success") Boolean notifyOnSuccess,
        @JsonProperty("notify_on_failure") Boolean notifyOnFailure,
        @JsonProperty("depends_on") List<String> dependsOn) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Build the export record of a job.
     *
     * @param dependsOn names of the job's prerequisites
     */
    public static JobDefinition from(Job job, List<String> dependsOn) {
        return new JobDefinition(
                job.name(),
                job.description(),
                job.kind().code(),
                job.command(),
                job.workingDirectory(),
                parseEnvironment(job.environment()),
                job.scheduleKind().code(),
                job.intervalMinutes(),
                job.cronExpression(),
                job.enabled(),
                job.maxRetries(),
                job.retryDelaySeconds(),
                job.timeoutSeconds(),
                job.notificationTarget(),
                job.notifyOnSuccess(),
                job.notifyOnFailure(),
                dependsOn == null || dependsOn.isEmpty() ? null : List.copyOf(dependsOn));
    }

    /**
     * Convert to a job definition ready for {@link JobService#create(Job)}.
     * The ID is a placeholder that create() replaces.
     *
     * @throws InvalidJobException if the name or command is missing, or a type code is unknown
     */
    public Job toJob() {
        if (name == null || name.isBlank()) {
            throw new InvalidJobException("Job name is required");
        }
        if (command == null || command.isBlank()) {
            throw new InvalidJobException("Command is required for job " + name);
        }
        JobKind kind;
        ScheduleKind scheduleKind;
        try {
            kind = JobKind.fromCode(jobType);
            scheduleKind = ScheduleKind.fromCode(scheduleType);
        } catch (IllegalArgumentException e) {
            throw new InvalidJobException(e.getMessage() + " (job " + name + ")", e);
        }

        Job.Builder builder = Job.builder()
                .id("import")
                .name(name)
                .description(description)
                .kind(kind)
                .command(command)
                .workingDirectory(workingDirectory)
                .environment(environmentText())
                .scheduleKind(scheduleKind)
                .intervalMinutes(intervalMinutes)
                .cronExpression(cronExpression)
                .timeoutSeconds(timeoutSeconds)
                .notificationTarget(notificationTarget);

        if (enabled != null) {
            builder.enabled(enabled);
        }
        if (maxRetries != null) {
            builder.maxRetries(maxRetries);
        }
        if (retryDelaySeconds != null) {
            builder.retryDelaySeconds(retryDelaySeconds);
        }
        if (notifyOnSuccess != null) {
            builder.notifyOnSuccess(notifyOnSuccess);
        }
        if (notifyOnFailure != null) {
            builder.notifyOnFailure(notifyOnFailure);
        }
        return builder.build();
    }

    /** Environment overrides as stored text; accepts either a JSON object or a JSON-encoded string */
    private String environmentText() {
        if (environmentVars == null || environmentVars.isNull()) {
            return null;
        }
        return environmentVars.isTextual() ? environmentVars.asText() : environmentVars.toString();
    }

    private static JsonNode parseEnvironment(String environment) {
        if (environment == null || environment.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readTree(environment);
        } catch (Exception e) {
            // Keep unparseable stored text verbatim
            return MAPPER.getNodeFactory().textNode(environment);
        }
    }
}
