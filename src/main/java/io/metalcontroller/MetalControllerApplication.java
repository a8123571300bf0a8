package io.metalcontroller;

import io.etcd.jetcd.Client;
import io.metalcontroller.config.ControllerConfig;
import io.metalcontroller.election.LeaderElection;
import io.metalcontroller.filter.QualifierFilterChain;
import io.metalcontroller.inventory.InventorySnapshotLoader;
import io.metalcontroller.metrics.MetricsProvider;
import io.metalcontroller.reconcile.ReconcileDispatcher;
import io.metalcontroller.reconcile.ServerClassReconciler;
import io.metalcontroller.reconcile.ServerFanOutRouter;
import io.metalcontroller.reconcile.StatusAggregator;
import io.metalcontroller.reconcile.StatusPatchCommitter;
import io.metalcontroller.store.EtcdMetadataStore;
import io.metalcontroller.store.EtcdPathResolver;
import io.metalcontroller.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Main Spring Boot application class for the server class controller.
 *
 * The controller keeps the status of every server class in etcd up to date with the set of
 * accepted servers that satisfy its qualifiers, split into available and in-use servers.
 */
@Slf4j
@SpringBootApplication
public class MetalControllerApplication {

    public static void main(String[] args) {
        log.info("Starting Server Class Controller");

        try {
            SpringApplication.run(MetalControllerApplication.class, args);
            log.info("Server Class Controller started successfully");

        } catch (Exception e) {
            log.error("Failed to start Server Class Controller: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public ControllerConfig config() {
        ControllerConfig config = new ControllerConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean(destroyMethod = "")
    public Client etcdClient(ControllerConfig config) {
        log.info("Connecting to etcd at {}", String.join(",", config.getEtcdEndpoints()));
        return Client.builder().endpoints(config.getEtcdEndpoints()).build();
    }

    @Bean
    public EtcdPathResolver pathResolver(ControllerConfig config) {
        return new EtcdPathResolver(config.getKeyPrefix());
    }

    /**
     * MetadataStore bean; closing it closes the etcd client.
     */
    @Bean(destroyMethod = "close")
    public MetadataStore metadataStore(Client etcdClient, EtcdPathResolver pathResolver, ControllerConfig config) {
        log.info("Initializing MetadataStore connection to etcd");
        return new EtcdMetadataStore(etcdClient, pathResolver, config.getOperationTimeoutSeconds());
    }

    @Bean
    public InventorySnapshotLoader inventorySnapshotLoader(MetadataStore metadataStore) {
        return new InventorySnapshotLoader(metadataStore);
    }

    @Bean
    public QualifierFilterChain qualifierFilterChain() {
        return new QualifierFilterChain();
    }

    @Bean
    public StatusAggregator statusAggregator() {
        return new StatusAggregator();
    }

    @Bean
    public StatusPatchCommitter statusPatchCommitter(MetadataStore metadataStore, MetricsProvider metricsProvider) {
        return new StatusPatchCommitter(metadataStore, metricsProvider);
    }

    @Bean
    public ServerClassReconciler serverClassReconciler(MetadataStore metadataStore,
                                                       InventorySnapshotLoader inventorySnapshotLoader,
                                                       QualifierFilterChain qualifierFilterChain,
                                                       StatusAggregator statusAggregator,
                                                       StatusPatchCommitter statusPatchCommitter,
                                                       MetricsProvider metricsProvider) {
        log.info("Initializing ServerClassReconciler");
        return new ServerClassReconciler(metadataStore, inventorySnapshotLoader, qualifierFilterChain,
                statusAggregator, statusPatchCommitter, metricsProvider);
    }

    @Bean
    public ServerFanOutRouter serverFanOutRouter(MetadataStore metadataStore, MetricsProvider metricsProvider) {
        return new ServerFanOutRouter(metadataStore, metricsProvider);
    }

    @Bean
    public ReconcileDispatcher reconcileDispatcher(ServerClassReconciler reconciler, ControllerConfig config) {
        log.info("Initializing ReconcileDispatcher with {} workers", config.getReconcileWorkers());
        return new ReconcileDispatcher(reconciler, config.getReconcileWorkers(),
                config.getBackoffInitialMillis(), config.getBackoffMaxMillis());
    }

    @Bean
    public LeaderElection leaderElection(Client etcdClient, EtcdPathResolver pathResolver,
                                         @Value("${controller.id}") String controllerId) {
        return new LeaderElection(etcdClient, pathResolver.getLeaderElectionKey(), controllerId);
    }

    /**
     * The controller starts campaigning for leadership on context startup.
     */
    @Bean
    public ServerClassController serverClassController(MetadataStore metadataStore,
                                                       ServerFanOutRouter serverFanOutRouter,
                                                       ReconcileDispatcher reconcileDispatcher,
                                                       LeaderElection leaderElection,
                                                       ControllerConfig config) {
        log.info("Initializing ServerClassController");
        return new ServerClassController(metadataStore, serverFanOutRouter, reconcileDispatcher,
                leaderElection, config.getResyncIntervalSeconds());
    }
}
