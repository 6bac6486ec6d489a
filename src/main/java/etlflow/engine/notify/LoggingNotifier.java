package etlflow.engine.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback channel: writes the notification to the log.
 * Used when the target's channel is not configured.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public NotifyResult send(Notification notification) {
        log.info("Notification for {}: {}", notification.target(), notification.subject());
        return NotifyResult.ok("logged");
    }
}
