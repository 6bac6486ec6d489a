package etlflow.engine.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Posts a Slack-compatible {@code {"text": ...}} message to a webhook URL.
 * With a fixed URL every notification goes there; otherwise the notification target is the URL.
 */
public class WebhookNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int TIMEOUT_SECONDS = 30;

    private final String fixedUrl;
    private final HttpClient httpClient;

    public WebhookNotifier() {
        this(null);
    }

    public WebhookNotifier(String fixedUrl) {
        this.fixedUrl = fixedUrl;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(TIMEOUT_SECONDS))
                .build();
    }

    @Override
    public NotifyResult send(Notification notification) {
        String url = fixedUrl != null ? fixedUrl : notification.target();
        try {
            String body = MAPPER.writeValueAsString(payload(notification));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Content-Type", "application/json; charset=utf-8")
                    .timeout(Duration.ofSeconds(TIMEOUT_SECONDS))
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int statusCode = response.statusCode();
            if (statusCode >= 200 && statusCode < 300) {
                log.info("Webhook notification sent: job={}, url={}", notification.jobName(), url);
                return NotifyResult.ok();
            }
            log.warn("Webhook notification rejected: url={}, statusCode={}, body={}", url, statusCode, response.body());
            return NotifyResult.fail("HTTP status " + statusCode);
        } catch (IOException e) {
            log.error("Webhook notification failed: url={}", url, e);
            return NotifyResult.fail("Network error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return NotifyResult.fail("Interrupted");
        } catch (IllegalArgumentException e) {
            log.error("Invalid webhook URL: {}", url, e);
            return NotifyResult.fail("Invalid URL: " + e.getMessage());
        }
    }

    ObjectNode payload(Notification notification) {
        ObjectNode payload = MAPPER.createObjectNode();
        String icon = notification.success() ? ":white_check_mark:" : ":x:";
        payload.put("text", icon + " " + notification.subject());
        return payload;
    }
}
