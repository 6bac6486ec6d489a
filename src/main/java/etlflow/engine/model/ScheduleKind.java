package etlflow.engine.model;

import java.util.Locale;

/**
 * How a job is scheduled.
 */
public enum ScheduleKind {
    /** Only runs when triggered explicitly */
    MANUAL,
    /** Runs every N minutes after the last run */
    INTERVAL,
    /** Runs on a cron expression */
    CRON;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScheduleKind fromCode(String value) {
        if (value == null || value.isBlank()) {
            return MANUAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown schedule kind: " + value, e);
        }
    }
}
