package etlflow;

import etlflow.engine.config.Dependencies;
import etlflow.engine.config.EngineConfig;
import etlflow.engine.model.Job;
import etlflow.engine.service.InvalidJobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Headless entry point.
 *
 * <pre>
 * etlflow [--settings settings.json]                 run the scheduler until stopped
 * etlflow [--settings settings.json] --import FILE   import job definitions and exit
 * etlflow [--settings settings.json] --export FILE   export job definitions and exit
 * </pre>
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);
    private static final String DEFAULT_SETTINGS = "settings.json";

    private static final CountDownLatch closed = new CountDownLatch(1);

    public static void main(String[] args) {
        Path settings = Path.of(System.getenv().getOrDefault("ETLFLOW_SETTINGS", DEFAULT_SETTINGS));
        Path importFile = null;
        Path exportFile = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--settings" -> settings = Path.of(requireValue(args, ++i, "--settings"));
                case "--import" -> importFile = Path.of(requireValue(args, ++i, "--import"));
                case "--export" -> exportFile = Path.of(requireValue(args, ++i, "--export"));
                default -> {
                    System.err.println("Unknown argument: " + args[i]);
                    System.exit(2);
                }
            }
        }

        EngineConfig config;
        try {
            config = EngineConfig.fromSettingsFile(settings);
        } catch (IOException e) {
            log.error("Failed to read settings file {}", settings, e);
            System.exit(1);
            return;
        } catch (IllegalArgumentException e) {
            log.error("Invalid settings in {}: {}", settings, e.getMessage());
            System.exit(1);
            return;
        }

        try (Dependencies deps = Dependencies.create(config)) {
            if (importFile != null) {
                List<Job> imported = deps.jobTransferService().importJobs(importFile);
                log.info("Imported {} jobs from {}", imported.size(), importFile);
                return;
            }
            if (exportFile != null) {
                int exported = deps.jobTransferService().exportJobs(exportFile);
                log.info("Exported {} jobs to {}", exported, exportFile);
                return;
            }
            runUntilStopped(deps);
        } catch (IOException e) {
            log.error("Job transfer failed", e);
            System.exit(1);
        } catch (InvalidJobException e) {
            log.error("Import aborted: {}", e.getMessage());
            System.exit(1);
        } finally {
            closed.countDown();
        }
    }

    private static void runUntilStopped(Dependencies deps) {
        deps.statusBus().subscribe((jobId, status, output) -> log.info("Job {} is now {}", jobId, status));

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping scheduler...");
            stopped.countDown();
            // Keep the JVM alive until main has closed the engine
            try {
                closed.await(15, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "etlflow-shutdown"));

        deps.startScheduler();
        log.info("Engine running, {} jobs defined", deps.jobService().findAll().size());

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            System.err.println("Missing value for " + option);
            System.exit(2);
        }
        return args[index];
    }
}
