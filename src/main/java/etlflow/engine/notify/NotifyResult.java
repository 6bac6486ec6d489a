package etlflow.engine.notify;

/**
 * Result of a notification delivery attempt.
 */
public record NotifyResult(boolean success, String message) {

    public static NotifyResult ok() {
        return new NotifyResult(true, "sent");
    }

    public static NotifyResult ok(String message) {
        return new NotifyResult(true, message);
    }

    public static NotifyResult fail(String message) {
        return new NotifyResult(false, message);
    }
}
