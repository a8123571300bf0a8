package io.metalcontroller.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import static io.metalcontroller.config.Constants.*;

/**
 * Configuration for the server class controller.
 * Loads configuration from application.yml with fallbacks to constants.
 */
@Slf4j
@Getter
public class ControllerConfig {

    private final String[] etcdEndpoints;
    private final String keyPrefix;
    private final long operationTimeoutSeconds;
    private final int reconcileWorkers;
    private final long resyncIntervalSeconds;
    private final long backoffInitialMillis;
    private final long backoffMaxMillis;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    static final String EXTERNAL_CONFIG_ENV_VAR = "CONTROLLER_CONFIG_FILE";

    public ControllerConfig() {
        this(System.getenv(EXTERNAL_CONFIG_ENV_VAR), DEFAULT_CONFIG_FILE_CLASSPATH);
    }

    public ControllerConfig(String externalConfigPath, String classpathResource) {
        ConfigModel config = loadYamlConfig(externalConfigPath, classpathResource);

        this.etcdEndpoints = parseEndpoints(config);
        this.keyPrefix = parseKeyPrefix(config);
        this.operationTimeoutSeconds = parseOperationTimeout(config);
        this.reconcileWorkers = parseReconcileWorkers(config);
        this.resyncIntervalSeconds = parseResyncInterval(config);
        this.backoffInitialMillis = parseBackoffInitial(config);
        this.backoffMaxMillis = Math.max(parseBackoffMax(config), backoffInitialMillis);

        log.info("Loaded controller config - etcd endpoints: {}, key prefix: {}, workers: {}, resync: {}s",
                String.join(", ", etcdEndpoints), keyPrefix, reconcileWorkers, resyncIntervalSeconds);
    }

    private ConfigModel loadYamlConfig(String externalConfigPath, String classpathResource) {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. External config file path
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. Classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", classpathResource);
            inputStream = getClass().getClassLoader().getResourceAsStream(classpathResource);
            loadedFrom = "classpath (" + classpathResource + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", classpathResource);
                return new ConfigModel();
            }
        }

        // 3. Parse
        try (InputStream in = inputStream) {
            ConfigModel config = yaml.load(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private String[] parseEndpoints(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null
                && !config.getEtcd().getEndpoints().isEmpty()) {
            return config.getEtcd().getEndpoints().toArray(new String[0]);
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private String parseKeyPrefix(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getKey_prefix() != null
                && !config.getEtcd().getKey_prefix().isBlank()) {
            String prefix = config.getEtcd().getKey_prefix().trim();
            if (!prefix.startsWith(PATH_DELIMITER)) {
                prefix = PATH_DELIMITER + prefix;
            }
            while (prefix.length() > 1 && prefix.endsWith(PATH_DELIMITER)) {
                prefix = prefix.substring(0, prefix.length() - 1);
            }
            return prefix;
        }
        return DEFAULT_KEY_PREFIX;
    }

    private long parseOperationTimeout(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getOperation_timeout_seconds() != null
                && config.getEtcd().getOperation_timeout_seconds() > 0) {
            return config.getEtcd().getOperation_timeout_seconds();
        }
        return DEFAULT_ETCD_OPERATION_TIMEOUT_SECONDS;
    }

    private int parseReconcileWorkers(ConfigModel config) {
        if (config.getReconcile() != null && config.getReconcile().getWorkers() != null) {
            if (config.getReconcile().getWorkers() > 0) {
                return config.getReconcile().getWorkers();
            }
            log.warn("Ignoring non-positive reconcile worker count {}, using default {}",
                    config.getReconcile().getWorkers(), DEFAULT_RECONCILE_WORKERS);
        }
        return DEFAULT_RECONCILE_WORKERS;
    }

    private long parseResyncInterval(ConfigModel config) {
        if (config.getReconcile() != null && config.getReconcile().getResync_interval_seconds() != null
                && config.getReconcile().getResync_interval_seconds() >= 0) {
            return config.getReconcile().getResync_interval_seconds();
        }
        return DEFAULT_RESYNC_INTERVAL_SECONDS;
    }

    private long parseBackoffInitial(ConfigModel config) {
        Backoff backoff = config.getReconcile() != null ? config.getReconcile().getBackoff() : null;
        if (backoff != null && backoff.getInitial_millis() != null && backoff.getInitial_millis() > 0) {
            return backoff.getInitial_millis();
        }
        return DEFAULT_BACKOFF_INITIAL_MILLIS;
    }

    private long parseBackoffMax(ConfigModel config) {
        Backoff backoff = config.getReconcile() != null ? config.getReconcile().getBackoff() : null;
        if (backoff != null && backoff.getMax_millis() != null && backoff.getMax_millis() > 0) {
            return backoff.getMax_millis();
        }
        return DEFAULT_BACKOFF_MAX_MILLIS;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Etcd etcd;
        private Reconcile reconcile;
        private Controller controller; // read by Spring @Value
        private Object server;         // Spring Boot server settings
        private Object management;     // Spring Boot actuator settings
        private Object spring;
        private Object logging;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
        private String key_prefix;
        private Long operation_timeout_seconds;
    }

    @Data
    public static class Reconcile {
        private Integer workers;
        private Long resync_interval_seconds;
        private Backoff backoff;
    }

    @Data
    public static class Backoff {
        private Long initial_millis;
        private Long max_millis;
    }

    @Data
    public static class Controller {
        private String id;
    }
}
