package io.metalcontroller.reconcile;

import io.metalcontroller.metrics.MetricsProvider;
import io.metalcontroller.models.ServerClass;
import io.metalcontroller.models.ServerClassKey;
import io.metalcontroller.models.ServerClassStatus;
import io.metalcontroller.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static io.metalcontroller.metrics.MetricsConstants.SERVER_CLASS_TAG;
import static io.metalcontroller.metrics.MetricsConstants.STATUS_COMMITS_METRIC_NAME;

/**
 * Writes a recomputed status back to the store, guarded by the version the class was read at.
 */
@Slf4j
public class StatusPatchCommitter {

    private final MetadataStore metadataStore;
    private final MetricsProvider metricsProvider;

    public StatusPatchCommitter(MetadataStore metadataStore, MetricsProvider metricsProvider) {
        this.metadataStore = metadataStore;
        this.metricsProvider = metricsProvider;
    }

    /**
     * @return true if a write was issued, false if the status was already current
     * @throws Exception version conflicts, missing class and store failures are propagated unchanged
     */
    public boolean commit(ServerClass serverClass, ServerClassStatus computed) throws Exception {
        ServerClassKey key = ServerClassKey.of(serverClass);
        ServerClassStatus previous = serverClass.getStatus() != null ? serverClass.getStatus() : new ServerClassStatus();

        if (previous.equals(computed)) {
            log.debug("Commit - Status of {} unchanged, skipping write", key);
            return false;
        }

        log.info("Commit - Updating status of {}: available {} -> {}, in use {} -> {}", key,
                previous.getServersAvailable(), computed.getServersAvailable(),
                previous.getServersInUse(), computed.getServersInUse());

        metadataStore.patchServerClassStatus(key, serverClass.getResourceVersion(), computed);
        metricsProvider.counter(STATUS_COMMITS_METRIC_NAME, Map.of(SERVER_CLASS_TAG, key.toString())).increment();
        return true;
    }
}
