package io.metalcontroller.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import io.etcd.jetcd.options.WatchOption;
import io.etcd.jetcd.watch.WatchEvent;
import io.metalcontroller.models.Qualifiers;
import io.metalcontroller.models.Server;
import io.metalcontroller.models.ServerClass;
import io.metalcontroller.models.ServerClassKey;
import io.metalcontroller.models.ServerClassStatus;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * etcd-based implementation of MetadataStore.
 * Servers and server classes are JSON documents; the mod revision of a server class key
 * is its version token.
 */
@Slf4j
public class EtcdMetadataStore implements MetadataStore {

    private static final String STATUS_FIELD = "status";

    private final Client etcdClient;
    private final KV kvClient;
    private final Watch watchClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;
    private final long operationTimeoutSeconds;

    public EtcdMetadataStore(Client etcdClient, EtcdPathResolver pathResolver, long operationTimeoutSeconds) {
        this.etcdClient = etcdClient;
        this.kvClient = etcdClient.getKVClient();
        this.watchClient = etcdClient.getWatchClient();
        this.pathResolver = pathResolver;
        this.operationTimeoutSeconds = operationTimeoutSeconds;
        this.objectMapper = new ObjectMapper();

        log.info("EtcdMetadataStore initialized with servers prefix {} and server classes prefix {}",
                pathResolver.getServersPrefix(), pathResolver.getServerClassesPrefix());
    }

    // =================================================================
    // SERVER OPERATIONS
    // =================================================================

    @Override
    public List<Server> listServers() throws Exception {
        log.debug("Listing servers from etcd");

        try {
            GetResponse response = executeEtcdPrefixQuery(pathResolver.getServersPrefix());

            List<Server> servers = new ArrayList<>();
            for (KeyValue kv : response.getKvs()) {
                String key = kv.getKey().toString(UTF_8);
                Optional<String> serverName = pathResolver.parseServerName(key);
                if (serverName.isEmpty()) {
                    log.debug("Skipping non-server key {}", key);
                    continue;
                }
                try {
                    Server server = objectMapper.readValue(kv.getValue().toString(UTF_8), Server.class);
                    // the key is authoritative for the identity
                    server.setName(serverName.get());
                    servers.add(server);
                } catch (Exception parseException) {
                    log.warn("Failed to parse server at key {}: {}", key, parseException.getMessage());
                }
            }

            log.debug("Retrieved {} servers from etcd", servers.size());
            return servers;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new Exception("Interrupted while listing servers from etcd", e);
        } catch (Exception e) {
            log.error("Failed to list servers from etcd: {}", e.getMessage(), e);
            throw new Exception("Failed to retrieve servers from etcd", e);
        }
    }

    // =================================================================
    // SERVER CLASS OPERATIONS
    // =================================================================

    @Override
    public List<ServerClass> listServerClasses() throws Exception {
        log.debug("Listing server classes from etcd");

        try {
            GetResponse response = executeEtcdPrefixQuery(pathResolver.getServerClassesPrefix());

            List<ServerClass> serverClasses = new ArrayList<>();
            for (KeyValue kv : response.getKvs()) {
                String key = kv.getKey().toString(UTF_8);
                Optional<ServerClassKey> classKey = pathResolver.parseServerClassKey(key);
                if (classKey.isEmpty()) {
                    log.debug("Skipping non-serverclass key {}", key);
                    continue;
                }
                try {
                    serverClasses.add(deserializeServerClass(classKey.get(), kv));
                } catch (Exception parseException) {
                    log.warn("Failed to parse server class at key {}: {}", key, parseException.getMessage());
                }
            }

            log.debug("Retrieved {} server classes from etcd", serverClasses.size());
            return serverClasses;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new Exception("Interrupted while listing server classes from etcd", e);
        } catch (Exception e) {
            log.error("Failed to list server classes from etcd: {}", e.getMessage(), e);
            throw new Exception("Failed to retrieve server classes from etcd", e);
        }
    }

    @Override
    public Optional<ServerClass> getServerClass(ServerClassKey key) throws Exception {
        log.debug("Getting server class {} from etcd", key);

        try {
            GetResponse response = executeEtcdGet(pathResolver.getServerClassPath(key));
            if (response.getKvs().isEmpty()) {
                log.debug("Server class {} not found in etcd", key);
                return Optional.empty();
            }
            return Optional.of(deserializeServerClass(key, response.getKvs().get(0)));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new Exception("Interrupted while getting server class from etcd", e);
        } catch (Exception e) {
            log.error("Failed to get server class {} from etcd: {}", key, e.getMessage(), e);
            throw new Exception("Failed to retrieve server class from etcd", e);
        }
    }

    @Override
    public void patchServerClassStatus(ServerClassKey key, long resourceVersion, ServerClassStatus status)
            throws Exception {
        log.debug("Patching status of server class {} at revision {}", key, resourceVersion);

        String path = pathResolver.getServerClassPath(key);
        ByteSequence keyBytes = ByteSequence.from(path, UTF_8);

        try {
            GetResponse getResponse = executeEtcdGet(path);
            if (getResponse.getKvs().isEmpty()) {
                throw new ResourceNotFoundException("Server class " + key + " not found");
            }
            KeyValue current = getResponse.getKvs().get(0);
            if (current.getModRevision() != resourceVersion) {
                throw new VersionConflictException("Server class " + key + " is at revision "
                        + current.getModRevision() + ", expected " + resourceVersion);
            }

            // only the status is owned here; every other stored field is written back untouched
            JsonNode stored = objectMapper.readTree(current.getValue().toString(UTF_8));
            if (!(stored instanceof ObjectNode)) {
                throw new Exception("Server class " + key + " is not a JSON object");
            }
            ObjectNode document = (ObjectNode) stored;
            document.set(STATUS_FIELD, objectMapper.valueToTree(status));
            ByteSequence valueBytes = ByteSequence.from(objectMapper.writeValueAsString(document), UTF_8);

            // Compare-and-swap on the revision the caller read
            TxnResponse txnResponse = kvClient.txn()
                    .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.modRevision(resourceVersion)))
                    .Then(Op.put(keyBytes, valueBytes, PutOption.DEFAULT))
                    .commit()
                    .get(operationTimeoutSeconds, TimeUnit.SECONDS);

            if (!txnResponse.isSucceeded()) {
                throw new VersionConflictException("Server class " + key
                        + " was modified concurrently after revision " + resourceVersion);
            }

            log.debug("Successfully patched status of server class {}", key);

        } catch (VersionConflictException | ResourceNotFoundException e) {
            log.info("Status patch of server class {} rejected: {}", key, e.getMessage());
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new Exception("Interrupted while patching server class status in etcd", e);
        } catch (Exception e) {
            log.error("Failed to patch status of server class {} in etcd: {}", key, e.getMessage(), e);
            throw new Exception("Failed to patch server class status in etcd", e);
        }
    }

    // =================================================================
    // WATCH OPERATIONS
    // =================================================================

    @Override
    public Closeable watchServers(Consumer<String> onServerChange) {
        String prefix = pathResolver.getServersPrefix();
        log.info("Watching servers under {}", prefix);
        return watchPrefix(prefix, event -> {
            String key = event.getKeyValue().getKey().toString(UTF_8);
            pathResolver.parseServerName(key).ifPresent(onServerChange);
        });
    }

    @Override
    public Closeable watchServerClasses(Consumer<ServerClassKey> onServerClassChange) {
        String prefix = pathResolver.getServerClassesPrefix();
        log.info("Watching server classes under {}", prefix);
        return watchPrefix(prefix, event -> {
            String key = event.getKeyValue().getKey().toString(UTF_8);
            pathResolver.parseServerClassKey(key).ifPresent(onServerClassChange);
        });
    }

    private Watch.Watcher watchPrefix(String prefix, Consumer<WatchEvent> onEvent) {
        ByteSequence prefixBytes = ByteSequence.from(prefix, UTF_8);
        return watchClient.watch(
                prefixBytes,
                WatchOption.builder().withPrefix(prefixBytes).build(),
                watchResponse -> {
                    for (WatchEvent event : watchResponse.getEvents()) {
                        log.debug("Watch event {} on {}", event.getEventType(),
                                event.getKeyValue().getKey().toString(UTF_8));
                        try {
                            onEvent.accept(event);
                        } catch (Exception e) {
                            log.error("Error handling watch event under {}: {}", prefix, e.getMessage(), e);
                        }
                    }
                },
                throwable -> log.error("Error in watch on {}: {}", prefix, throwable.getMessage(), throwable)
        );
    }

    @Override
    public void close() throws Exception {
        log.info("Closing etcd metadata store");
        etcdClient.close();
    }

    // =================================================================
    // HELPERS
    // =================================================================

    private GetResponse executeEtcdPrefixQuery(String prefix) throws Exception {
        ByteSequence prefixBytes = ByteSequence.from(prefix, UTF_8);
        CompletableFuture<GetResponse> future = kvClient.get(
                prefixBytes,
                GetOption.builder().withPrefix(prefixBytes).build());
        return future.get(operationTimeoutSeconds, TimeUnit.SECONDS);
    }

    private GetResponse executeEtcdGet(String key) throws Exception {
        return kvClient.get(ByteSequence.from(key, UTF_8)).get(operationTimeoutSeconds, TimeUnit.SECONDS);
    }

    private ServerClass deserializeServerClass(ServerClassKey key, KeyValue kv) throws Exception {
        ServerClass serverClass = objectMapper.readValue(kv.getValue().toString(UTF_8), ServerClass.class);
        serverClass.setNamespace(key.getNamespace());
        serverClass.setName(key.getName());
        serverClass.setResourceVersion(kv.getModRevision());
        if (serverClass.getQualifiers() == null) {
            serverClass.setQualifiers(new Qualifiers());
        }
        if (serverClass.getStatus() == null) {
            serverClass.setStatus(new ServerClassStatus());
        }
        normalizeNullLists(serverClass);
        return serverClass;
    }

    // explicit JSON nulls read as empty lists
    private void normalizeNullLists(ServerClass serverClass) {
        ServerClassStatus status = serverClass.getStatus();
        if (status.getServersAvailable() == null) {
            status.setServersAvailable(new ArrayList<>());
        }
        if (status.getServersInUse() == null) {
            status.setServersInUse(new ArrayList<>());
        }
        Qualifiers qualifiers = serverClass.getQualifiers();
        if (qualifiers.getCpu() == null) {
            qualifiers.setCpu(new ArrayList<>());
        }
        if (qualifiers.getSystemInformation() == null) {
            qualifiers.setSystemInformation(new ArrayList<>());
        }
        if (qualifiers.getLabelSelectors() == null) {
            qualifiers.setLabelSelectors(new ArrayList<>());
        }
    }
}
