package etlflow.engine.notify;

/**
 * Delivery channel for job outcome notifications.
 * Implementations report delivery problems through the result and do not throw.
 */
public interface Notifier {

    NotifyResult send(Notification notification);
}
