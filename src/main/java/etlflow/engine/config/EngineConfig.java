package etlflow.engine.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for engine settings.
 * All settings have sensible defaults.
 */
public final class EngineConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/etlflow;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Scheduler settings
    private Duration pollInterval = Duration.ofSeconds(30);
    private int maxConcurrentJobs = 5;
    private Duration cronDebounce = Duration.ofSeconds(60);

    // Execution settings
    private String scriptInterpreter = "python3";

    // SMTP settings
    private String smtpHost = "smtp.gmail.com";
    private int smtpPort = 587;
    private String smtpUsername = "";
    private String smtpPassword = "";
    private boolean smtpUseTls = true;
    private String smtpFrom = "";

    // Webhook (Slack) settings
    private boolean webhookEnabled = false;
    private String webhookUrl = "";

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        EngineConfig config = new EngineConfig();
        config.applyEnv();
        return config;
    }

    /**
     * Load a settings.json file, then apply environment overrides on top.
     * A missing file yields the defaults.
     *
     * <pre>
     * {
     *   "scheduler": {"check_interval_seconds": 30, "max_concurrent_jobs": 5},
     *   "smtp": {"host": "...", "port": 587, "username": "", "password": "", "use_tls": true, "from_email": ""},
     *   "slack": {"enabled": false, "webhook_url": ""}
     * }
     * </pre>
     */
    public static EngineConfig fromSettingsFile(Path settingsFile) throws IOException {
        EngineConfig config = new EngineConfig();
        if (Files.exists(settingsFile)) {
            JsonNode root = new ObjectMapper().readTree(settingsFile.toFile());
            config.applySettings(root);
        }
        config.applyEnv();
        return config;
    }

    private void applySettings(JsonNode root) {
        JsonNode scheduler = root.path("scheduler");
        if (scheduler.has("check_interval_seconds")) {
            pollInterval = Duration.ofSeconds(
                    requirePositive(scheduler.get("check_interval_seconds").asLong(30), "check_interval_seconds"));
        }
        if (scheduler.has("max_concurrent_jobs")) {
            maxConcurrentJobs = (int) requirePositive(scheduler.get("max_concurrent_jobs").asInt(5),
                    "max_concurrent_jobs");
        }
        if (scheduler.has("script_interpreter")) {
            scriptInterpreter = scheduler.get("script_interpreter").asText(scriptInterpreter);
        }

        JsonNode smtp = root.path("smtp");
        smtpHost = smtp.path("host").asText(smtpHost);
        smtpPort = smtp.path("port").asInt(smtpPort);
        smtpUsername = smtp.path("username").asText(smtpUsername);
        smtpPassword = smtp.path("password").asText(smtpPassword);
        smtpUseTls = smtp.path("use_tls").asBoolean(smtpUseTls);
        smtpFrom = smtp.path("from_email").asText(smtpFrom);

        JsonNode slack = root.path("slack");
        webhookEnabled = slack.path("enabled").asBoolean(webhookEnabled);
        webhookUrl = slack.path("webhook_url").asText(webhookUrl);

        JsonNode database = root.path("database");
        databaseUrl = database.path("url").asText(databaseUrl);
        databasePoolSize = database.path("pool_size").asInt(databasePoolSize);
    }

    private void applyEnv() {
        String dbUrl = System.getenv("ETLFLOW_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String poll = System.getenv("ETLFLOW_POLL_SECONDS");
        if (poll != null && !poll.isBlank()) {
            pollInterval = Duration.ofSeconds(requirePositive(Long.parseLong(poll), "ETLFLOW_POLL_SECONDS"));
        }

        String maxConcurrent = System.getenv("ETLFLOW_MAX_CONCURRENT_JOBS");
        if (maxConcurrent != null && !maxConcurrent.isBlank()) {
            maxConcurrentJobs = (int) requirePositive(Integer.parseInt(maxConcurrent), "ETLFLOW_MAX_CONCURRENT_JOBS");
        }

        String interpreter = System.getenv("ETLFLOW_SCRIPT_INTERPRETER");
        if (interpreter != null && !interpreter.isBlank()) {
            scriptInterpreter = interpreter;
        }
    }

    private static long requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int maxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    public Duration cronDebounce() {
        return cronDebounce;
    }

    public String scriptInterpreter() {
        return scriptInterpreter;
    }

    public String smtpHost() {
        return smtpHost;
    }

    public int smtpPort() {
        return smtpPort;
    }

    public String smtpUsername() {
        return smtpUsername;
    }

    public String smtpPassword() {
        return smtpPassword;
    }

    public boolean smtpUseTls() {
        return smtpUseTls;
    }

    public String smtpFrom() {
        return smtpFrom;
    }

    public boolean hasSmtpCredentials() {
        return smtpHost != null && !smtpHost.isBlank() && smtpUsername != null && !smtpUsername.isBlank();
    }

    public boolean webhookEnabled() {
        return webhookEnabled;
    }

    public String webhookUrl() {
        return webhookUrl;
    }

    // Fluent setters for testing/customization
    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public EngineConfig withMaxConcurrentJobs(int maxConcurrentJobs) {
        this.maxConcurrentJobs = maxConcurrentJobs;
        return this;
    }

    public EngineConfig withCronDebounce(Duration debounce) {
        this.cronDebounce = debounce;
        return this;
    }

    public EngineConfig withScriptInterpreter(String interpreter) {
        this.scriptInterpreter = interpreter;
        return this;
    }

    public EngineConfig withSmtp(String host, int port, String username, String password, boolean useTls,
            String from) {
        this.smtpHost = host;
        this.smtpPort = port;
        this.smtpUsername = username;
        this.smtpPassword = password;
        this.smtpUseTls = useTls;
        this.smtpFrom = from;
        return this;
    }

    public EngineConfig withWebhook(String url) {
        this.webhookEnabled = url != null && !url.isBlank();
        this.webhookUrl = url;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", pollInterval=" + pollInterval +
                ", maxConcurrentJobs=" + maxConcurrentJobs +
                ", scriptInterpreter='" + scriptInterpreter + '\'' +
                ", smtpConfigured=" + hasSmtpCredentials() +
                ", webhookEnabled=" + webhookEnabled +
                '}';
    }
}
