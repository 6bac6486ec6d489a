package etlflow.engine.execution;

import etlflow.engine.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Fans job status events out to listeners on a dedicated thread, in publish order.
 * Publishing never blocks on a listener.
 */
public final class StatusBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StatusBus.class);

    private final CopyOnWriteArrayList<StatusListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService delivery = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "etlflow-status-bus");
        t.setDaemon(true);
        return t;
    });

    public void subscribe(StatusListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(StatusListener listener) {
        listeners.remove(listener);
    }

    public void publish(String jobId, JobStatus status, String output) {
        if (listeners.isEmpty()) {
            return;
        }
        try {
            delivery.execute(() -> deliver(jobId, status, output));
        } catch (RejectedExecutionException e) {
            log.debug("Status bus closed, dropping {} for job {}", status, jobId);
        }
    }

    private void deliver(String jobId, JobStatus status, String output) {
        for (StatusListener listener : listeners) {
            try {
                listener.onStatus(jobId, status, output);
            } catch (Exception e) {
                log.warn("Status listener failed for job {} ({}): {}", jobId, status, e.getMessage(), e);
            }
        }
    }

    @Override
    public void close() {
        delivery.shutdown();
        try {
            if (!delivery.awaitTermination(2, TimeUnit.SECONDS)) {
                delivery.shutdownNow();
            }
        } catch (InterruptedException e) {
            delivery.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
