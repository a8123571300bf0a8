package io.metalcontroller.inventory;

import io.metalcontroller.models.Server;
import io.metalcontroller.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Reads the current server inventory and keeps only accepted servers.
 * Every call reads a fresh snapshot; nothing is cached between calls.
 */
@Slf4j
public class InventorySnapshotLoader {

    private final MetadataStore metadataStore;

    public InventorySnapshotLoader(MetadataStore metadataStore) {
        this.metadataStore = metadataStore;
    }

    /**
     * @return accepted servers keyed by name, unmodifiable
     * @throws Exception if the store read fails
     */
    public SortedMap<String, Server> loadAcceptedServers() throws Exception {
        List<Server> servers = metadataStore.listServers();

        SortedMap<String, Server> accepted = new TreeMap<>();
        for (Server server : servers) {
            if (server.isAccepted()) {
                accepted.put(server.getName(), server);
            }
        }

        log.debug("Inventory - {} of {} servers are accepted", accepted.size(), servers.size());
        return Collections.unmodifiableSortedMap(accepted);
    }
}
