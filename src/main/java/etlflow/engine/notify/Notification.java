package etlflow.engine.notify;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * A finished job run to report to the job's notification target.
 */
public record Notification(
        String jobName,
        String target,
        boolean success,
        String output,
        String errorOutput,
        Instant finishedAt) {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public String statusLabel() {
        return success ? "SUCCESS" : "FAILED";
    }

    public String subject() {
        return "Job " + jobName + " " + statusLabel();
    }

    public String body() {
        String time = LocalDateTime.ofInstant(finishedAt, ZoneId.systemDefault()).format(TIME_FORMAT);
        return """
                Job: %s
                Status: %s
                Time: %s

                Output:
                %s

                Error Output:
                %s
                """.formatted(jobName, statusLabel(), time, nullToEmpty(output), nullToEmpty(errorOutput));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
