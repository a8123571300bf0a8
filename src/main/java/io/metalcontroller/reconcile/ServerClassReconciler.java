package io.metalcontroller.reconcile;

import io.metalcontroller.enums.ReconcileOutcome;
import io.metalcontroller.enums.ReconcilePhase;
import io.metalcontroller.filter.QualifierFilterChain;
import io.metalcontroller.inventory.InventorySnapshotLoader;
import io.metalcontroller.metrics.MetricsProvider;
import io.metalcontroller.models.Server;
import io.metalcontroller.models.ServerClass;
import io.metalcontroller.models.ServerClassKey;
import io.metalcontroller.models.ServerClassStatus;
import io.metalcontroller.store.MetadataStore;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

import static io.metalcontroller.metrics.MetricsConstants.*;

/**
 * Reconciles one server class: fetch, filter, aggregate, commit.
 *
 * The phases run strictly in sequence on the calling thread. Failures are raised to the caller
 * as {@link ReconcileException}; retrying is the caller's job.
 */
@Slf4j
public class ServerClassReconciler {

    private final MetadataStore metadataStore;
    private final InventorySnapshotLoader snapshotLoader;
    private final QualifierFilterChain filterChain;
    private final StatusAggregator statusAggregator;
    private final StatusPatchCommitter patchCommitter;
    private final MetricsProvider metricsProvider;

    public ServerClassReconciler(MetadataStore metadataStore,
                                 InventorySnapshotLoader snapshotLoader,
                                 QualifierFilterChain filterChain,
                                 StatusAggregator statusAggregator,
                                 StatusPatchCommitter patchCommitter,
                                 MetricsProvider metricsProvider) {
        this.metadataStore = metadataStore;
        this.snapshotLoader = snapshotLoader;
        this.filterChain = filterChain;
        this.statusAggregator = statusAggregator;
        this.patchCommitter = patchCommitter;
        this.metricsProvider = metricsProvider;
    }

    public ReconcileOutcome reconcile(ServerClassKey key) throws ReconcileException {
        log.debug("Reconcile - Fetching server class {}", key);
        Timer.Sample sample = Timer.start();
        ReconcilePhase phase = ReconcilePhase.FETCHING;

        try {
            Optional<ServerClass> fetched = metadataStore.getServerClass(key);
            if (fetched.isEmpty()) {
                log.debug("Reconcile - Server class {} no longer exists, nothing to do", key);
                clearGauges(key);
                return record(key, sample, ReconcileOutcome.NOT_FOUND);
            }
            ServerClass serverClass = fetched.get();
            SortedMap<String, Server> accepted = snapshotLoader.loadAcceptedServers();

            phase = ReconcilePhase.FILTERING;
            SortedMap<String, Server> matched = filterChain.apply(accepted, serverClass.getQualifiers());

            phase = ReconcilePhase.AGGREGATING;
            ServerClassStatus computed = statusAggregator.aggregate(matched);
            updateGauges(key, computed);

            phase = ReconcilePhase.COMMITTING;
            boolean written = patchCommitter.commit(serverClass, computed);

            phase = ReconcilePhase.DONE;
            log.debug("Reconcile - Server class {} done: {} available, {} in use, written={}", key,
                    computed.getServersAvailable().size(), computed.getServersInUse().size(), written);
            return record(key, sample, written ? ReconcileOutcome.UPDATED : ReconcileOutcome.UNCHANGED);

        } catch (Exception e) {
            record(key, sample, null);
            log.warn("Reconcile - Server class {} failed while {}: {}", key, phase, e.getMessage());
            throw new ReconcileException(key, phase, e);
        }
    }

    private ReconcileOutcome record(ServerClassKey key, Timer.Sample sample, ReconcileOutcome outcome) {
        String result = outcome != null ? outcome.metricValue() : ReconcilePhase.FAILED.name().toLowerCase();
        sample.stop(metricsProvider.timer(RECONCILE_LATENCY_METRIC_NAME, Map.of(SERVER_CLASS_TAG, key.toString())));
        metricsProvider.counter(RECONCILE_TOTAL_METRIC_NAME, Map.of(RESULT_TAG, result)).increment();
        return outcome;
    }

    // a deleted class must not keep exporting its last counts
    private void clearGauges(ServerClassKey key) {
        Map<String, String> tags = Map.of(SERVER_CLASS_TAG, key.toString());
        metricsProvider.removeGauge(SERVERS_AVAILABLE_METRIC_NAME, tags);
        metricsProvider.removeGauge(SERVERS_IN_USE_METRIC_NAME, tags);
    }

    private void updateGauges(ServerClassKey key, ServerClassStatus status) {
        Map<String, String> tags = Map.of(SERVER_CLASS_TAG, key.toString());
        metricsProvider.gauge(SERVERS_AVAILABLE_METRIC_NAME, tags).set(status.getServersAvailable().size());
        metricsProvider.gauge(SERVERS_IN_USE_METRIC_NAME, tags).set(status.getServersInUse().size());
    }
}
