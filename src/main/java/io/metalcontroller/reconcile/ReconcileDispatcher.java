package io.metalcontroller.reconcile;

import io.metalcontroller.models.ServerClassKey;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keyed work queue feeding a bounded pool of reconcile workers.
 *
 * <ul>
 *   <li>A key waiting in the queue is not queued twice.</li>
 *   <li>A key is never processed by two workers at once; a key enqueued while it is being
 *       processed runs again after the current run finishes.</li>
 *   <li>Retryable failures are re-queued with per-key exponential backoff.</li>
 * </ul>
 */
@Slf4j
public class ReconcileDispatcher {

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ServerClassReconciler reconciler;
    private final int workerCount;
    private final long initialBackoffMillis;
    private final long maxBackoffMillis;

    private final Object lock = new Object();
    private final BlockingQueue<ServerClassKey> queue = new LinkedBlockingQueue<>();
    private final Set<ServerClassKey> queued = new HashSet<>();
    private final Set<ServerClassKey> processing = new HashSet<>();
    private final Set<ServerClassKey> dirty = new HashSet<>();
    private final Map<ServerClassKey, Integer> failures = new HashMap<>();

    private ExecutorService workers;
    private ScheduledExecutorService retryScheduler;
    private volatile boolean running = false;

    public ReconcileDispatcher(ServerClassReconciler reconciler, int workerCount,
                               long initialBackoffMillis, long maxBackoffMillis) {
        this.reconciler = reconciler;
        this.workerCount = workerCount;
        this.initialBackoffMillis = initialBackoffMillis;
        this.maxBackoffMillis = maxBackoffMillis;
    }

    public void start() {
        synchronized (lock) {
            if (running) {
                return;
            }
            AtomicInteger workerIds = new AtomicInteger();
            workers = Executors.newFixedThreadPool(workerCount, r -> {
                Thread t = new Thread(r);
                t.setName("reconcile-worker-" + workerIds.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            retryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "reconcile-retry");
                t.setDaemon(true);
                return t;
            });
            running = true;
        }

        for (int i = 0; i < workerCount; i++) {
            workers.submit(this::workerLoop);
        }
        log.info("Dispatcher - Started {} reconcile workers", workerCount);
    }

    public void stop() {
        ExecutorService workersToStop;
        ScheduledExecutorService schedulerToStop;
        synchronized (lock) {
            if (!running) {
                return;
            }
            running = false;
            workersToStop = workers;
            schedulerToStop = retryScheduler;
            queue.clear();
            queued.clear();
            dirty.clear();
            failures.clear();
        }

        log.info("Dispatcher - Stopping reconcile workers");
        schedulerToStop.shutdownNow();
        workersToStop.shutdownNow();
        try {
            if (!workersToStop.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Dispatcher - Workers did not terminate within {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Request a reconcile of {@code key}. Ignored while the dispatcher is stopped.
     */
    public void enqueue(ServerClassKey key) {
        synchronized (lock) {
            if (!running) {
                log.debug("Dispatcher - Not running, dropping request for {}", key);
                return;
            }
            if (processing.contains(key)) {
                dirty.add(key);
                return;
            }
            if (queued.add(key)) {
                queue.offer(key);
            }
        }
    }

    public boolean isRunning() {
        return running;
    }

    public int getQueueDepth() {
        synchronized (lock) {
            return queued.size();
        }
    }

    long backoffMillis(int failureCount) {
        int shift = Math.min(failureCount - 1, 30);
        long delay = initialBackoffMillis << shift;
        return delay <= 0 || delay > maxBackoffMillis ? maxBackoffMillis : delay;
    }

    private void workerLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            ServerClassKey key;
            try {
                key = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            synchronized (lock) {
                queued.remove(key);
                processing.add(key);
            }

            try {
                process(key);
            } finally {
                synchronized (lock) {
                    processing.remove(key);
                    if (dirty.remove(key) && running && queued.add(key)) {
                        queue.offer(key);
                    }
                }
            }
        }
    }

    private void process(ServerClassKey key) {
        try {
            reconciler.reconcile(key);
            synchronized (lock) {
                failures.remove(key);
            }
        } catch (ReconcileException e) {
            if (!e.isRetryable()) {
                log.warn("Dispatcher - Dropping {} after non-retryable failure: {}", key, e.getMessage());
                synchronized (lock) {
                    failures.remove(key);
                }
                return;
            }
            scheduleRetry(key, e);
        } catch (RuntimeException e) {
            log.error("Dispatcher - Unexpected error reconciling {}: {}", key, e.getMessage(), e);
            scheduleRetry(key, e);
        }
    }

    private void scheduleRetry(ServerClassKey key, Exception cause) {
        long delay;
        synchronized (lock) {
            if (!running) {
                return;
            }
            int count = failures.merge(key, 1, Integer::sum);
            delay = backoffMillis(count);
            retryScheduler.schedule(() -> enqueue(key), delay, TimeUnit.MILLISECONDS);
        }
        log.info("Dispatcher - Retrying {} in {} ms after: {}", key, delay, cause.getMessage());
    }
}
