package io.metalcontroller.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static io.metalcontroller.config.Constants.*;
import static org.assertj.core.api.Assertions.assertThat;

class ControllerConfigTest {

    @Test
    void testLoadsClasspathConfig() {
        ControllerConfig config = new ControllerConfig(null, "controller-test.yml");

        assertThat(config.getEtcdEndpoints()).containsExactly("http://etcd-0:2379", "http://etcd-1:2379");
        assertThat(config.getOperationTimeoutSeconds()).isEqualTo(3);
        assertThat(config.getReconcileWorkers()).isEqualTo(8);
        assertThat(config.getResyncIntervalSeconds()).isZero();
    }

    @Test
    void testKeyPrefixIsNormalized() {
        ControllerConfig config = new ControllerConfig(null, "controller-test.yml");

        assertThat(config.getKeyPrefix()).isEqualTo("/sidero");
    }

    @Test
    void testBackoffMaxNeverBelowInitial() {
        ControllerConfig config = new ControllerConfig(null, "controller-test.yml");

        assertThat(config.getBackoffInitialMillis()).isEqualTo(250);
        assertThat(config.getBackoffMaxMillis()).isEqualTo(250);
    }

    @Test
    void testBundledApplicationConfig() {
        ControllerConfig config = new ControllerConfig(null, "application.yml");

        assertThat(config.getEtcdEndpoints()).containsExactly("http://localhost:2379");
        assertThat(config.getKeyPrefix()).isEqualTo("/metal");
        assertThat(config.getReconcileWorkers()).isEqualTo(4);
        assertThat(config.getResyncIntervalSeconds()).isEqualTo(600);
    }

    @Test
    void testMissingConfigFallsBackToDefaults() {
        ControllerConfig config = new ControllerConfig(null, "does-not-exist.yml");

        assertDefaults(config);
    }

    @Test
    void testMalformedConfigFallsBackToDefaults() {
        ControllerConfig config = new ControllerConfig(null, "controller-invalid.yml");

        assertDefaults(config);
    }

    @Test
    void testExternalFileTakesPrecedence(@TempDir Path dir) throws Exception {
        Path external = dir.resolve("controller.yml");
        Files.writeString(external, "etcd:\n  key_prefix: /lab\nreconcile:\n  workers: 0\n");

        ControllerConfig config = new ControllerConfig(external.toString(), "controller-test.yml");

        assertThat(config.getKeyPrefix()).isEqualTo("/lab");
        assertThat(config.getReconcileWorkers()).isEqualTo(DEFAULT_RECONCILE_WORKERS);
        assertThat(config.getEtcdEndpoints()).containsExactly(DEFAULT_ETCD_ENDPOINT);
    }

    @Test
    void testMissingExternalFileFallsBackToClasspath(@TempDir Path dir) {
        ControllerConfig config = new ControllerConfig(dir.resolve("absent.yml").toString(), "controller-test.yml");

        assertThat(config.getKeyPrefix()).isEqualTo("/sidero");
    }

    private static void assertDefaults(ControllerConfig config) {
        assertThat(config.getEtcdEndpoints()).containsExactly(DEFAULT_ETCD_ENDPOINT);
        assertThat(config.getKeyPrefix()).isEqualTo(DEFAULT_KEY_PREFIX);
        assertThat(config.getOperationTimeoutSeconds()).isEqualTo(DEFAULT_ETCD_OPERATION_TIMEOUT_SECONDS);
        assertThat(config.getReconcileWorkers()).isEqualTo(DEFAULT_RECONCILE_WORKERS);
        assertThat(config.getResyncIntervalSeconds()).isEqualTo(DEFAULT_RESYNC_INTERVAL_SECONDS);
        assertThat(config.getBackoffInitialMillis()).isEqualTo(DEFAULT_BACKOFF_INITIAL_MILLIS);
        assertThat(config.getBackoffMaxMillis()).isEqualTo(DEFAULT_BACKOFF_MAX_MILLIS);
    }
}
