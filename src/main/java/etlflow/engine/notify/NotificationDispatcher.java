package etlflow.engine.notify;

import etlflow.engine.config.EngineConfig;
import etlflow.engine.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Routes finished runs to a notification channel off the execution thread.
 * <p>
 * Targets starting with http(s):// go to a webhook, targets containing '@' go to mail when
 * SMTP credentials are configured, anything else is logged. A globally configured webhook
 * additionally receives every notification. Delivery failures are logged and never reach
 * the caller.
 */
public class NotificationDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Notifier emailNotifier;
    private final Notifier webhookNotifier;
    private final Notifier broadcastNotifier;
    private final Notifier fallbackNotifier;
    private final ExecutorService delivery = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "etlflow-notifier");
        t.setDaemon(true);
        return t;
    });

    /**
     * @param emailNotifier     mail channel, or null when SMTP is not configured
     * @param webhookNotifier   channel for URL targets
     * @param broadcastNotifier channel that receives every notification, or null
     * @param fallbackNotifier  channel for targets no other channel accepts
     */
    public NotificationDispatcher(Notifier emailNotifier, Notifier webhookNotifier, Notifier broadcastNotifier,
            Notifier fallbackNotifier) {
        this.emailNotifier = emailNotifier;
        this.webhookNotifier = webhookNotifier;
        this.broadcastNotifier = broadcastNotifier;
        this.fallbackNotifier = fallbackNotifier;
    }

    public static NotificationDispatcher fromConfig(EngineConfig config) {
        Notifier email = config.hasSmtpCredentials()
                ? new EmailNotifier(config.smtpHost(), config.smtpPort(), config.smtpUsername(),
                        config.smtpPassword(), config.smtpUseTls(), config.smtpFrom())
                : null;
        Notifier broadcast = config.webhookEnabled() && !config.webhookUrl().isBlank()
                ? new WebhookNotifier(config.webhookUrl()) : null;
        return new NotificationDispatcher(email, new WebhookNotifier(), broadcast, new LoggingNotifier());
    }

    /**
     * Queue a notification for the finished run if the job asks for one.
     */
    public void notifyFinished(Job job, boolean success, String output, String errorOutput) {
        if (!job.shouldNotify(success)) {
            return;
        }
        Notification notification = new Notification(job.name(), job.notificationTarget(), success,
                output, errorOutput, Instant.now());
        try {
            delivery.execute(() -> deliver(notification));
        } catch (RejectedExecutionException e) {
            log.warn("Notifier closed, dropping notification for job {}", job.name());
        }
    }

    void deliver(Notification notification) {
        send(route(notification.target()), notification);
        if (broadcastNotifier != null) {
            send(broadcastNotifier, notification);
        }
    }

    Notifier route(String target) {
        String normalized = target.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("http://") || normalized.startsWith("https://")) {
            return webhookNotifier;
        }
        if (normalized.contains("@") && emailNotifier != null) {
            return emailNotifier;
        }
        return fallbackNotifier;
    }

    private void send(Notifier notifier, Notification notification) {
        try {
            NotifyResult result = notifier.send(notification);
            if (!result.success()) {
                log.warn("Notification for job {} not delivered: {}", notification.jobName(), result.message());
            }
        } catch (Exception e) {
            log.error("Notifier failed for job {}", notification.jobName(), e);
        }
    }

    @Override
    public void close() {
        delivery.shutdown();
        try {
            if (!delivery.awaitTermination(5, TimeUnit.SECONDS)) {
                delivery.shutdownNow();
            }
        } catch (InterruptedException e) {
            delivery.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
