package io.metalcontroller.metrics;

/**
 * Constants for metrics names and tags used in the server class controller.
 */
public class MetricsConstants {
    public final static String RECONCILE_TOTAL_METRIC_NAME = "server_class_reconcile_total";
    public final static String RECONCILE_LATENCY_METRIC_NAME = "server_class_reconcile_latency";
    public final static String STATUS_COMMITS_METRIC_NAME = "server_class_status_commits";
    public final static String FANOUT_FAILURES_METRIC_NAME = "server_class_fanout_failures";
    public final static String SERVERS_AVAILABLE_METRIC_NAME = "server_class_servers_available";
    public final static String SERVERS_IN_USE_METRIC_NAME = "server_class_servers_in_use";
    public final static String SERVER_CLASS_TAG = "serverClass";
    public final static String RESULT_TAG = "result";

    private MetricsConstants() {}
}
