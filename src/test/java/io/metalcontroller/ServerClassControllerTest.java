package io.metalcontroller;

import io.metalcontroller.election.LeaderElection;
import io.metalcontroller.filter.QualifierFilterChain;
import io.metalcontroller.inventory.InventorySnapshotLoader;
import io.metalcontroller.metrics.MetricsProvider;
import io.metalcontroller.models.ServerClass;
import io.metalcontroller.models.ServerClassKey;
import io.metalcontroller.models.ServerClassStatus;
import io.metalcontroller.reconcile.ReconcileDispatcher;
import io.metalcontroller.reconcile.ServerClassReconciler;
import io.metalcontroller.reconcile.ServerFanOutRouter;
import io.metalcontroller.reconcile.StatusAggregator;
import io.metalcontroller.reconcile.StatusPatchCommitter;
import io.metalcontroller.store.InMemoryMetadataStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static io.metalcontroller.TestFixtures.NAMESPACE;
import static io.metalcontroller.TestFixtures.server;
import static io.metalcontroller.TestFixtures.serverClass;
import static io.metalcontroller.TestFixtures.serverWithLabels;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ServerClassControllerTest {

    private static final ServerClassKey WORKERS = new ServerClassKey(NAMESPACE, "workers");
    private static final ServerClassKey STORAGE = new ServerClassKey(NAMESPACE, "storage");

    private InMemoryMetadataStore store;
    private ServerFanOutRouter router;
    private ReconcileDispatcher dispatcher;
    private LeaderElection leaderElection;
    private ServerClassController controller;

    @BeforeEach
    void setUp() {
        store = new InMemoryMetadataStore();
        MetricsProvider metrics = new MetricsProvider(new SimpleMeterRegistry(), "test-controller");
        router = spy(new ServerFanOutRouter(store, metrics));
        ServerClassReconciler reconciler = new ServerClassReconciler(
                store,
                new InventorySnapshotLoader(store),
                new QualifierFilterChain(),
                new StatusAggregator(),
                new StatusPatchCommitter(store, metrics),
                metrics);
        dispatcher = spy(new ReconcileDispatcher(reconciler, 2, 10, 100));
        leaderElection = mock(LeaderElection.class);
        controller = new ServerClassController(store, router, dispatcher, leaderElection, 0);
    }

    @AfterEach
    void tearDown() {
        controller.stop();
    }

    private static void waitFor(Supplier<Boolean> condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.get()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }

    private ServerClassStatus statusOf(ServerClassKey key) {
        try {
            return store.getServerClass(key).orElseThrow().getStatus();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    void testStartsReconcilingAfterWinningElection() {
        when(leaderElection.startElection()).thenReturn(CompletableFuture.completedFuture(true));

        controller.start();

        assertThat(controller.isReconciling()).isTrue();
        verify(dispatcher).start();
    }

    @Test
    void testFailedElectionDoesNotReconcile() {
        when(leaderElection.startElection()).thenReturn(CompletableFuture.failedFuture(new RuntimeException("no quorum")));

        controller.start();

        assertThat(controller.isReconciling()).isFalse();
        verify(dispatcher, never()).start();
    }

    @Test
    void testInitialSyncReconcilesExistingClasses() throws Exception {
        store.putServer(server("m1", true, false));
        store.putServer(server("m2", true, true));
        store.putServerClass(serverClass("workers"));

        controller.startReconciling();

        verify(router, timeout(5000)).enumerateServerClasses("initial sync");
        waitFor(() -> statusOf(WORKERS).getServersInUse().equals(List.of("m2")));
        assertThat(statusOf(WORKERS).getServersAvailable()).containsExactly("m1");
    }

    @Test
    void testServerChangeFansOutToEveryClass() throws Exception {
        ServerClass workers = serverClass("workers");
        workers.getQualifiers().setLabelSelectors(List.of(Map.of("role", "worker")));
        store.putServerClass(workers);
        store.putServerClass(serverClass("storage"));
        controller.startReconciling();
        verify(router, timeout(5000)).enumerateServerClasses("initial sync");

        store.putServer(serverWithLabels("m4", Map.of("role", "worker")));

        verify(router, timeout(5000)).mapServerChange("m4");
        waitFor(() -> statusOf(WORKERS).getServersAvailable().contains("m4"));
        waitFor(() -> statusOf(STORAGE).getServersAvailable().contains("m4"));
    }

    @Test
    void testServerClassChangeIsEnqueued() throws Exception {
        store.putServer(server("m1", true, false));
        controller.startReconciling();

        store.putServerClass(serverClass("workers"));

        verify(dispatcher, timeout(5000)).enqueue(WORKERS);
        waitFor(() -> statusOf(WORKERS).getServersAvailable().equals(List.of("m1")));
    }

    @Test
    void testServerChangesAreFannedOutOffTheWatchThreadAndCoalesced() throws Exception {
        store.putServerClass(serverClass("workers"));
        controller.startReconciling();
        verify(router, timeout(5000)).enumerateServerClasses("initial sync");

        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return invocation.callRealMethod();
        }).when(router).mapServerChange(anyString());

        controller.onServerChange("m1");
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        // the first fan-out is still blocked; these collapse into one more
        controller.onServerChange("m2");
        controller.onServerChange("m3");
        controller.onServerChange("m4");
        release.countDown();

        verify(router, timeout(5000).times(2)).mapServerChange(anyString());
        verify(router, after(300).times(2)).mapServerChange(anyString());
        verify(router).mapServerChange("m1");
        verify(router).mapServerChange("m2");
        verify(dispatcher, timeout(5000).atLeast(3)).enqueue(WORKERS);
    }

    @Test
    void testServerChangeBeforeReconcilingIsIgnored() {
        controller.onServerChange("m1");

        verify(router, after(200).never()).mapServerChange(anyString());
    }

    @Test
    void testLostLeadershipStopsReconciling() {
        when(leaderElection.startElection()).thenReturn(new CompletableFuture<>());
        ArgumentCaptor<Runnable> onLost = ArgumentCaptor.forClass(Runnable.class);
        verify(leaderElection).setOnLeadershipLost(onLost.capture());
        controller.startReconciling();
        assertThat(controller.isReconciling()).isTrue();

        onLost.getValue().run();

        assertThat(controller.isReconciling()).isFalse();
        assertThat(dispatcher.isRunning()).isFalse();

        store.putServer(server("m9", true, false));
        verify(router, never()).mapServerChange(anyString());
    }

    @Test
    void testLostLeadershipCampaignsAgainAndResumes() {
        when(leaderElection.startElection()).thenReturn(CompletableFuture.completedFuture(true));
        ArgumentCaptor<Runnable> onLost = ArgumentCaptor.forClass(Runnable.class);
        verify(leaderElection).setOnLeadershipLost(onLost.capture());
        controller.start();
        assertThat(controller.isReconciling()).isTrue();

        onLost.getValue().run();

        verify(leaderElection, times(2)).startElection();
        verify(dispatcher, times(2)).start();
        verify(dispatcher).stop();
        assertThat(controller.isReconciling()).isTrue();
    }

    @Test
    void testLostLeadershipAfterStopDoesNotCampaign() {
        ArgumentCaptor<Runnable> onLost = ArgumentCaptor.forClass(Runnable.class);
        verify(leaderElection).setOnLeadershipLost(onLost.capture());

        controller.stop();
        onLost.getValue().run();

        verify(leaderElection, never()).startElection();
    }

    @Test
    void testFailedElectionIsRetried() {
        when(leaderElection.startElection())
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("no quorum")))
                .thenReturn(CompletableFuture.completedFuture(true));

        controller.start();

        verify(leaderElection, timeout(10_000).times(2)).startElection();
        verify(dispatcher, timeout(5000)).start();
    }

    @Test
    void testStopShutsDownElectionAndPreventsRestart() {
        controller.stop();
        controller.startReconciling();

        assertThat(controller.isReconciling()).isFalse();
        verify(leaderElection).shutdown();
        verify(dispatcher, never()).start();
    }

    @Test
    void testHealthAccessors() {
        when(leaderElection.isLeader()).thenReturn(true);

        assertThat(controller.isLeader()).isTrue();
        assertThat(controller.getQueueDepth()).isZero();
        verify(dispatcher, never()).enqueue(any());
    }
}
