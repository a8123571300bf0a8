package io.metalcontroller;

import io.metalcontroller.election.LeaderElection;
import io.metalcontroller.models.ServerClassKey;
import io.metalcontroller.reconcile.ReconcileDispatcher;
import io.metalcontroller.reconcile.ServerFanOutRouter;
import io.metalcontroller.store.MetadataStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.metalcontroller.config.Constants.LEADER_ELECTION_RETRY_SECONDS;

/**
 * Wires store notifications to the reconcile dispatcher.
 *
 * Once this replica wins the leader election it:
 * - starts the dispatcher workers
 * - watches servers and fans every change out to all server classes
 * - watches server classes and enqueues the changed class
 * - enqueues every class at startup and then every resync interval
 *
 * Fan-outs run on the controller's own scheduler, never on the store's watch thread. A burst of
 * server changes collapses into a single pending fan-out since each one lists every class anyway.
 * Losing leadership stops reconciling and campaigns again until the controller is stopped.
 */
@Slf4j
public class ServerClassController {

    private final MetadataStore metadataStore;
    private final ServerFanOutRouter fanOutRouter;
    private final ReconcileDispatcher dispatcher;
    private final LeaderElection leaderElection;
    private final long resyncIntervalSeconds;

    private final Object lifecycleLock = new Object();
    private volatile ScheduledExecutorService eventScheduler;
    private final AtomicBoolean fanOutPending = new AtomicBoolean(false);
    private Closeable serverWatcher;
    private Closeable serverClassWatcher;
    private volatile boolean reconciling = false;
    private volatile boolean stopped = false;

    public ServerClassController(MetadataStore metadataStore,
                                 ServerFanOutRouter fanOutRouter,
                                 ReconcileDispatcher dispatcher,
                                 LeaderElection leaderElection,
                                 long resyncIntervalSeconds) {
        this.metadataStore = metadataStore;
        this.fanOutRouter = fanOutRouter;
        this.dispatcher = dispatcher;
        this.leaderElection = leaderElection;
        this.resyncIntervalSeconds = resyncIntervalSeconds;
        this.leaderElection.setOnLeadershipLost(this::onLeadershipLost);
    }

    /**
     * Campaign for leadership; reconciling starts once the campaign is won.
     */
    @PostConstruct
    public void start() {
        log.info("Starting ServerClassController, campaigning for leadership");
        campaign();
    }

    void campaign() {
        if (stopped) {
            return;
        }
        leaderElection.startElection()
                .thenAccept(won -> {
                    if (Boolean.TRUE.equals(won)) {
                        startReconciling();
                    }
                })
                .exceptionally(ex -> {
                    if (!stopped) {
                        log.error("Leader election failed, campaigning again in {}s: {}",
                                LEADER_ELECTION_RETRY_SECONDS, ex.getMessage());
                        CompletableFuture.runAsync(this::campaign,
                                CompletableFuture.delayedExecutor(LEADER_ELECTION_RETRY_SECONDS, TimeUnit.SECONDS));
                    }
                    return null;
                });
    }

    void onLeadershipLost() {
        stopReconciling();
        if (!stopped) {
            log.warn("ServerClassController lost leadership, campaigning again");
            campaign();
        }
    }

    @PreDestroy
    public void stop() {
        log.info("Stopping ServerClassController");
        stopped = true;
        stopReconciling();
        leaderElection.shutdown();
    }

    void startReconciling() {
        synchronized (lifecycleLock) {
            if (reconciling || stopped) {
                return;
            }
            dispatcher.start();

            serverWatcher = metadataStore.watchServers(this::onServerChange);
            serverClassWatcher = metadataStore.watchServerClasses(this::onServerClassChange);

            fanOutPending.set(false);
            eventScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "serverclass-events");
                t.setDaemon(true);
                return t;
            });
            if (resyncIntervalSeconds > 0) {
                eventScheduler.scheduleWithFixedDelay(
                        () -> resyncAll("periodic resync"),
                        0,
                        resyncIntervalSeconds,
                        TimeUnit.SECONDS);
            } else {
                eventScheduler.execute(() -> resyncAll("initial sync"));
            }

            reconciling = true;
            log.info("ServerClassController is reconciling (resync every {}s)", resyncIntervalSeconds);
        }
    }

    void stopReconciling() {
        synchronized (lifecycleLock) {
            if (!reconciling) {
                return;
            }
            reconciling = false;
            closeQuietly(serverWatcher, "server watch");
            closeQuietly(serverClassWatcher, "server class watch");
            serverWatcher = null;
            serverClassWatcher = null;
            eventScheduler.shutdownNow();
            dispatcher.stop();
            log.info("ServerClassController stopped reconciling");
        }
    }

    void onServerChange(String serverName) {
        ScheduledExecutorService scheduler = eventScheduler;
        if (scheduler == null) {
            return;
        }
        if (!fanOutPending.compareAndSet(false, true)) {
            log.debug("Fan-out already pending, coalescing change of server {}", serverName);
            return;
        }
        try {
            scheduler.execute(() -> {
                // cleared before listing so a change arriving mid fan-out schedules another one
                fanOutPending.set(false);
                fanOutRouter.mapServerChange(serverName).forEach(dispatcher::enqueue);
            });
        } catch (RejectedExecutionException e) {
            fanOutPending.set(false);
            log.debug("Dropped fan-out for server {}, controller is not reconciling", serverName);
        }
    }

    void onServerClassChange(ServerClassKey key) {
        dispatcher.enqueue(key);
    }

    void resyncAll(String reason) {
        List<ServerClassKey> requests = fanOutRouter.enumerateServerClasses(reason);
        log.info("Resync - Enqueueing {} server classes ({})", requests.size(), reason);
        requests.forEach(dispatcher::enqueue);
    }

    public boolean isReconciling() {
        return reconciling;
    }

    public boolean isLeader() {
        return leaderElection.isLeader();
    }

    public int getQueueDepth() {
        return dispatcher.getQueueDepth();
    }

    private void closeQuietly(Closeable closeable, String what) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", what, e.getMessage());
        }
    }
}
