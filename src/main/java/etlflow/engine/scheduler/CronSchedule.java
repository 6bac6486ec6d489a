package etlflow.engine.scheduler;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Parsed cron expression.
 * <p>
 * Accepts classic 5-field Unix expressions ({@code minute hour day month weekday}) as well as
 * the 6-field form with a leading seconds field. A 5-field expression fires at second 0.
 */
public final class CronSchedule {

    private final String expression;
    private final CronExpression cron;
    private final ZoneId zone;

    private CronSchedule(String expression, CronExpression cron, ZoneId zone) {
        this.expression = expression;
        this.cron = cron;
        this.zone = zone;
    }

    /**
     * @throws IllegalArgumentException if the expression is blank or malformed
     */
    public static CronSchedule parse(String expression) {
        return parse(expression, ZoneId.systemDefault());
    }

    public static CronSchedule parse(String expression, ZoneId zone) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression is required");
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        String normalized = switch (fields.length) {
            case 5 -> "0 " + String.join(" ", fields);
            case 6 -> String.join(" ", fields);
            default -> throw new IllegalArgumentException(
                    "Cron expression must have 5 or 6 fields, got " + fields.length + ": " + trimmed);
        };
        return new CronSchedule(trimmed, CronExpression.parse(normalized), zone);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * First fire time strictly after {@code from}, or null if the expression never fires again.
     */
    public Instant nextAfter(Instant from) {
        ZonedDateTime next = cron.next(from.atZone(zone));
        return next != null ? next.toInstant() : null;
    }

    /**
     * First fire time at or after {@code from}.
     */
    public Instant nextAtOrAfter(Instant from) {
        return nextAfter(from.minusNanos(1));
    }

    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }
}
