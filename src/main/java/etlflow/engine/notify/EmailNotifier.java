package etlflow.engine.notify;

import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Sends plain-text notification mail through an authenticated SMTP server.
 * The target of the notification is the recipient address.
 */
public class EmailNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(EmailNotifier.class);
    private static final int TIMEOUT_MS = 30000;

    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final boolean useTls;
    private final String from;

    public EmailNotifier(String host, int port, String username, String password, boolean useTls, String from) {
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;
        this.useTls = useTls;
        this.from = from == null || from.isBlank() ? username : from;
    }

    @Override
    public NotifyResult send(Notification notification) {
        try {
            MimeMessage message = new MimeMessage(session());
            message.setFrom(new InternetAddress(from));
            message.addRecipient(Message.RecipientType.TO, new InternetAddress(notification.target()));
            message.setSubject(notification.subject(), "UTF-8");
            message.setText(notification.body(), "UTF-8");

            Transport.send(message);

            log.info("Notification mail sent: job={}, to={}", notification.jobName(), notification.target());
            return NotifyResult.ok();
        } catch (MessagingException e) {
            log.error("Failed to send notification mail to {}", notification.target(), e);
            return NotifyResult.fail("Mail error: " + e.getMessage());
        }
    }

    Session session() {
        Properties props = new Properties();
        props.put("mail.smtp.host", host);
        props.put("mail.smtp.port", String.valueOf(port));
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.connectiontimeout", String.valueOf(TIMEOUT_MS));
        props.put("mail.smtp.timeout", String.valueOf(TIMEOUT_MS));
        props.put("mail.smtp.writetimeout", String.valueOf(TIMEOUT_MS));
        if (useTls) {
            props.put("mail.smtp.starttls.enable", "true");
        }

        return Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(username, password);
            }
        });
    }
}
