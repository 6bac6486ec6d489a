package etlflow.engine.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import etlflow.engine.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a job body as an external process and captures its output.
 * <p>
 * SCRIPT jobs run through the configured interpreter, SHELL and QUERY jobs through the
 * platform shell. The child environment is the current process environment overlaid with
 * the job's overrides; overrides that fail to parse are ignored.
 */
public class ProcessRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final long DRAIN_TIMEOUT_MS = 5000;
    private static final boolean WINDOWS = System.getProperty("os.name", "")
            .toLowerCase(Locale.ROOT).startsWith("windows");

    private final String scriptInterpreter;
    private final ExecutorService streamReaders = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "etlflow-process-io");
        t.setDaemon(true);
        return t;
    });

    public ProcessRunner(String scriptInterpreter) {
        this.scriptInterpreter = scriptInterpreter;
    }

    /**
     * Run one attempt of the job. Never throws for process-level problems: spawn failures
     * and timeouts come back as a result with exit code 1.
     */
    public ProcessResult run(Job job) {
        List<String> command = buildCommand(job);
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.environment().putAll(parseEnvironment(job));
        if (job.workingDirectory() != null && !job.workingDirectory().isBlank()) {
            builder.directory(new File(job.workingDirectory()));
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("Failed to start job {}: {}", job.name(), e.getMessage());
            return ProcessResult.failure("Failed to start process: " + e.getMessage());
        }

        // Close stdin and drain both pipes concurrently so a chatty child cannot block on a full pipe
        closeStdin(process);
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(
                () -> readAll(process.getInputStream()), streamReaders);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(
                () -> readAll(process.getErrorStream()), streamReaders);

        Integer timeoutSeconds = job.timeoutSeconds();
        try {
            boolean finished;
            if (timeoutSeconds != null && timeoutSeconds > 0) {
                finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            } else {
                process.waitFor();
                finished = true;
            }

            if (!finished) {
                destroyTree(process);
                log.warn("Job {} timed out after {} seconds", job.name(), timeoutSeconds);
                String errors = "Process timed out after " + timeoutSeconds + " seconds\n" + drain(stderr);
                return new ProcessResult(drain(stdout), errors, 1, true);
            }

            return new ProcessResult(drain(stdout), drain(stderr), process.exitValue(), false);
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            return new ProcessResult(drain(stdout), "Execution interrupted\n" + drain(stderr), 1, false);
        }
    }

    List<String> buildCommand(Job job) {
        List<String> command = new ArrayList<>();
        switch (job.kind()) {
            case SCRIPT -> {
                command.add(scriptInterpreter);
                command.addAll(Arrays.asList(job.command().trim().split("\\s+")));
            }
            // Queries go through a client CLI invoked from the shell
            case SHELL, QUERY -> {
                if (WINDOWS) {
                    command.add("cmd.exe");
                    command.add("/c");
                } else {
                    command.add("/bin/sh");
                    command.add("-c");
                }
                command.add(job.command());
            }
        }
        return command;
    }

    /**
     * Parse the job's environment overrides. Anything but a JSON object yields no overrides.
     */
    Map<String, String> parseEnvironment(Job job) {
        String raw = job.environment();
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            JsonNode node = MAPPER.readTree(raw);
            if (node == null || !node.isObject()) {
                log.debug("Ignoring environment overrides of job {}: not a JSON object", job.name());
                return Map.of();
            }
            Map<String, String> env = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                env.put(field.getKey(), value.isTextual() ? value.asText() : value.toString());
            }
            return env;
        } catch (IOException e) {
            log.debug("Ignoring unparseable environment overrides of job {}: {}", job.name(), e.getMessage());
            return Map.of();
        }
    }

    private void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.trace("Could not close stdin of pid {}", process.pid(), e);
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String drain(CompletableFuture<String> stream) {
        try {
            return stream.get(DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            stream.cancel(true);
            return "";
        }
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        streamReaders.shutdownNow();
    }
}
