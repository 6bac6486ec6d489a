package etlflow.engine.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @Test
    void defaults() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(Duration.ofSeconds(30), config.pollInterval());
        assertEquals(5, config.maxConcurrentJobs());
        assertEquals(Duration.ofSeconds(60), config.cronDebounce());
        assertEquals("python3", config.scriptInterpreter());
        assertEquals("smtp.gmail.com", config.smtpHost());
        assertEquals(587, config.smtpPort());
        assertFalse(config.hasSmtpCredentials());
        assertFalse(config.webhookEnabled());
        assertTrue(config.databaseUrl().startsWith("jdbc:h2:file:"));
    }

    @Test
    void settingsFileOverridesDefaults(@TempDir Path dir) throws Exception {
        Path settings = dir.resolve("settings.json");
        Files.writeString(settings, """
                {
                  "scheduler": {"check_interval_seconds": 10, "max_concurrent_jobs": 2, "script_interpreter": "python3.11"},
                  "smtp": {"host": "mail.example.com", "port": 2525, "username": "etl", "password": "secret",
                           "use_tls": false, "from_email": "etl@example.com"},
                  "slack": {"enabled": true, "webhook_url": "https://hooks.slack.com/services/T/B/X"},
                  "database": {"url": "jdbc:h2:mem:settings", "pool_size": 3}
                }
                """);

        EngineConfig config = EngineConfig.fromSettingsFile(settings);

        assertEquals(Duration.ofSeconds(10), config.pollInterval());
        assertEquals(2, config.maxConcurrentJobs());
        assertEquals("python3.11", config.scriptInterpreter());
        assertEquals("mail.example.com", config.smtpHost());
        assertEquals(2525, config.smtpPort());
        assertEquals("etl", config.smtpUsername());
        assertEquals("secret", config.smtpPassword());
        assertFalse(config.smtpUseTls());
        assertEquals("etl@example.com", config.smtpFrom());
        assertTrue(config.hasSmtpCredentials());
        assertTrue(config.webhookEnabled());
        assertEquals("https://hooks.slack.com/services/T/B/X", config.webhookUrl());
        assertEquals("jdbc:h2:mem:settings", config.databaseUrl());
        assertEquals(3, config.databasePoolSize());
    }

    @Test
    void partialSettingsKeepDefaults(@TempDir Path dir) throws Exception {
        Path settings = dir.resolve("settings.json");
        Files.writeString(settings, "{\"scheduler\": {\"max_concurrent_jobs\": 8}}");

        EngineConfig config = EngineConfig.fromSettingsFile(settings);

        assertEquals(8, config.maxConcurrentJobs());
        assertEquals(Duration.ofSeconds(30), config.pollInterval());
        assertEquals("smtp.gmail.com", config.smtpHost());
    }

    @Test
    void missingSettingsFileYieldsDefaults(@TempDir Path dir) throws Exception {
        EngineConfig config = EngineConfig.fromSettingsFile(dir.resolve("absent.json"));

        assertEquals(5, config.maxConcurrentJobs());
    }

    @Test
    void malformedSettingsFileIsAnError(@TempDir Path dir) throws Exception {
        Path settings = dir.resolve("settings.json");
        Files.writeString(settings, "{ not json");

        assertThrows(IOException.class, () -> EngineConfig.fromSettingsFile(settings));
    }

    @Test
    void nonPositiveCheckIntervalIsRejected(@TempDir Path dir) throws Exception {
        Path zero = dir.resolve("zero.json");
        Files.writeString(zero, "{\"scheduler\": {\"check_interval_seconds\": 0}}");
        Path negative = dir.resolve("negative.json");
        Files.writeString(negative, "{\"scheduler\": {\"check_interval_seconds\": -5}}");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromSettingsFile(zero));
        assertTrue(e.getMessage().contains("check_interval_seconds"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromSettingsFile(negative));
    }

    @Test
    void nonPositiveConcurrencyIsRejected(@TempDir Path dir) throws Exception {
        Path settings = dir.resolve("settings.json");
        Files.writeString(settings, "{\"scheduler\": {\"max_concurrent_jobs\": 0}}");

        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromSettingsFile(settings));
    }

    @Test
    void webhookSetterEnablesOnlyWithUrl() {
        assertTrue(EngineConfig.defaults().withWebhook("https://example.com/hook").webhookEnabled());
        assertFalse(EngineConfig.defaults().withWebhook(" ").webhookEnabled());
    }
}
