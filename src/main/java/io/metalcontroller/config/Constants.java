package io.metalcontroller.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String DEFAULT_KEY_PREFIX = "/metal";
    public static final long DEFAULT_ETCD_OPERATION_TIMEOUT_SECONDS = 5L;
    public static final int DEFAULT_RECONCILE_WORKERS = 4;
    public static final long DEFAULT_RESYNC_INTERVAL_SECONDS = 600L;
    public static final long DEFAULT_BACKOFF_INITIAL_MILLIS = 500L;
    public static final long DEFAULT_BACKOFF_MAX_MILLIS = 60_000L;

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_SERVERS = "servers";
    public static final String PATH_SERVER_CLASSES = "serverclasses";
    public static final String PATH_LEADER_ELECTION = "leader-election";

    // Leader election constants
    public static final long LEADER_ELECTION_TTL_SECONDS = 30L;
    public static final long LEADER_ELECTION_RETRY_SECONDS = 5L;
}
