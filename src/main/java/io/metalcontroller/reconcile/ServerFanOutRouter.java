package io.metalcontroller.reconcile;

import io.metalcontroller.metrics.MetricsProvider;
import io.metalcontroller.models.ServerClass;
import io.metalcontroller.models.ServerClassKey;
import io.metalcontroller.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.metalcontroller.metrics.MetricsConstants.FANOUT_FAILURES_METRIC_NAME;

/**
 * Maps a server change to reconcile requests for every server class.
 *
 * There is no index from server facts to the classes they affect, so every change re-evaluates
 * every class: O(classes) requests per server event.
 */
@Slf4j
public class ServerFanOutRouter {

    private final MetadataStore metadataStore;
    private final MetricsProvider metricsProvider;

    public ServerFanOutRouter(MetadataStore metadataStore, MetricsProvider metricsProvider) {
        this.metadataStore = metadataStore;
        this.metricsProvider = metricsProvider;
    }

    /**
     * @param serverName the server that changed, used for logging only
     * @return one key per server class; empty if the classes could not be listed
     */
    public List<ServerClassKey> mapServerChange(String serverName) {
        return enumerateServerClasses("server " + serverName + " changed");
    }

    /**
     * List every server class as a reconcile request. A listing failure yields no requests;
     * the affected classes catch up on the next trigger or resync.
     */
    public List<ServerClassKey> enumerateServerClasses(String reason) {
        List<ServerClassKey> requests = new ArrayList<>();
        try {
            for (ServerClass serverClass : metadataStore.listServerClasses()) {
                requests.add(ServerClassKey.of(serverClass));
            }
        } catch (Exception e) {
            log.error("FanOut - Failed to list server classes ({}), no reconcile requests issued: {}",
                    reason, e.getMessage(), e);
            metricsProvider.counter(FANOUT_FAILURES_METRIC_NAME, Map.of()).increment();
            return List.of();
        }

        log.debug("FanOut - {}: issuing {} reconcile requests", reason, requests.size());
        return requests;
    }
}
