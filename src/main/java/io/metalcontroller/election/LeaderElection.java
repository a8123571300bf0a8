package io.metalcontroller.election;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.Election;
import io.etcd.jetcd.lease.LeaseGrantResponse;
import io.etcd.jetcd.lease.LeaseKeepAliveResponse;
import io.etcd.jetcd.support.CloseableClient;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.metalcontroller.config.Constants.LEADER_ELECTION_TTL_SECONDS;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * etcd-backed leader election so that only one controller replica reconciles at a time.
 */
@Slf4j
public class LeaderElection {

    private final Client etcdClient;
    private final String electionKey;
    private final String nodeId;
    private final AtomicBoolean isLeader = new AtomicBoolean(false);
    private final AtomicBoolean isShuttingDown = new AtomicBoolean(false);
    private volatile Runnable onLeadershipLost = () -> { };
    private volatile CloseableClient keepAliveClient;
    private volatile long currentLeaseId;

    /**
     * @param etcdClient the etcd client instance
     * @param electionKey the etcd election name shared by all replicas
     * @param nodeId the unique identifier for this replica
     */
    public LeaderElection(Client etcdClient, String electionKey, String nodeId) {
        this.etcdClient = etcdClient;
        this.electionKey = electionKey;
        this.nodeId = nodeId;
    }

    /**
     * Register a callback run once when an acquired leadership is lost.
     */
    public void setOnLeadershipLost(Runnable onLeadershipLost) {
        this.onLeadershipLost = onLeadershipLost;
    }

    /**
     * Start campaigning asynchronously. Calling it again after leadership was lost campaigns
     * on a fresh lease; events from the previous lease are ignored.
     *
     * @return future completing with true when this replica becomes leader
     */
    public CompletableFuture<Boolean> startElection() {
        log.info("LeaderElection - Starting leader election for node: {}", nodeId);

        Election election = etcdClient.getElectionClient();
        CompletableFuture<Boolean> result = new CompletableFuture<>();

        CompletableFuture.runAsync(() -> {
            try {
                ByteSequence electionKeyBytes = ByteSequence.from(electionKey, UTF_8);
                ByteSequence nodeIdBytes = ByteSequence.from(nodeId, UTF_8);

                LeaseGrantResponse leaseGrant = etcdClient.getLeaseClient()
                        .grant(LEADER_ELECTION_TTL_SECONDS)
                        .get();
                long leaseId = leaseGrant.getID();

                currentLeaseId = leaseId;
                CloseableClient previous = keepAliveClient;
                if (previous != null) {
                    previous.close();
                }
                keepAliveClient = etcdClient.getLeaseClient().keepAlive(leaseId, new StreamObserver<LeaseKeepAliveResponse>() {
                    @Override
                    public void onNext(LeaseKeepAliveResponse res) {
                        //
                    }

                    @Override
                    public void onError(Throwable t) {
                        if (!isShuttingDown.get()) {
                            log.error("LeaderElection - Lease keep-alive error for node {}: {}", nodeId, t.getMessage());
                            result.completeExceptionally(t);
                        }
                        stepDown(leaseId);
                    }

                    @Override
                    public void onCompleted() {
                        log.warn("LeaderElection - Lease keep-alive completed for node {}, stepping down", nodeId);
                        stepDown(leaseId);
                    }
                });

                // blocks until leadership is acquired
                election.campaign(electionKeyBytes, leaseId, nodeIdBytes)
                        .thenAccept(leaderKey -> {
                            log.info("LeaderElection - Node {} is now the leader", nodeId);
                            isLeader.set(true);
                            result.complete(true);
                        })
                        .exceptionally(ex -> {
                            if (!isShuttingDown.get()) {
                                log.error("LeaderElection - Node {} failed during campaign: {}", nodeId, ex.getMessage(), ex);
                                result.completeExceptionally(ex);
                            } else {
                                log.debug("LeaderElection - Node {} election cancelled during shutdown", nodeId);
                            }
                            isLeader.set(false);
                            return null;
                        });

            } catch (Exception e) {
                log.error("LeaderElection - Election error for node {}: {}", nodeId, e.getMessage(), e);
                isLeader.set(false);
                result.completeExceptionally(e);
            }
        });

        log.info("LeaderElection - Election initiated asynchronously for node: {}", nodeId);
        return result;
    }

    public boolean isLeader() {
        return isLeader.get();
    }

    /**
     * Stop campaigning and give up leadership without notifying the lost-leadership callback.
     */
    public void shutdown() {
        log.info("LeaderElection - Shutting down leader election for node: {}", nodeId);
        isShuttingDown.set(true);
        isLeader.set(false);
        CloseableClient client = keepAliveClient;
        if (client != null) {
            client.close();
        }
    }

    private void stepDown(long leaseId) {
        if (leaseId != currentLeaseId) {
            log.debug("LeaderElection - Ignoring keep-alive end of superseded lease {}", leaseId);
            return;
        }
        if (isLeader.getAndSet(false) && !isShuttingDown.get()) {
            log.error("LeaderElection - Node {} lost leadership", nodeId);
            onLeadershipLost.run();
        }
    }
}
