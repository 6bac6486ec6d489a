package etlflow.engine.model;

import java.util.Locale;

/**
 * What kind of command body a job carries.
 * The code is the value used in exported job files.
 */
public enum JobKind {
    /** Script run through the configured interpreter */
    SCRIPT("python"),
    /** Command line run through the platform shell */
    SHELL("shell"),
    /** Query run through a client CLI, executed like SHELL */
    QUERY("sql");

    private final String code;

    JobKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolve either the export code ("python", "shell", "sql") or the enum name.
     */
    public static JobKind fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Job kind is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (JobKind kind : values()) {
            if (kind.code.equals(normalized) || kind.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown job kind: " + value);
    }
}
