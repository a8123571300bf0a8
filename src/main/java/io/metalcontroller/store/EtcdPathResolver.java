package io.metalcontroller.store;

import io.metalcontroller.models.ServerClassKey;

import java.util.Optional;

import static io.metalcontroller.config.Constants.*;

/**
 * Centralized etcd path resolver for server and server class keys.
 * Stateless apart from the configured root prefix.
 */
public class EtcdPathResolver {

    private final String rootPrefix;

    public EtcdPathResolver(String rootPrefix) {
        this.rootPrefix = rootPrefix.endsWith(PATH_DELIMITER)
                ? rootPrefix.substring(0, rootPrefix.length() - 1)
                : rootPrefix;
    }

    // =================================================================
    // SERVER PATHS
    // =================================================================

    /**
     * Get prefix for all servers
     * Pattern: /<root>/servers/
     */
    public String getServersPrefix() {
        return String.join(PATH_DELIMITER, rootPrefix, PATH_SERVERS) + PATH_DELIMITER;
    }

    /**
     * Pattern: /<root>/servers/<server-name>
     */
    public String getServerPath(String serverName) {
        return getServersPrefix() + serverName;
    }

    /**
     * Extract the server name from a server key, empty for keys outside the servers prefix.
     */
    public Optional<String> parseServerName(String key) {
        String prefix = getServersPrefix();
        if (!key.startsWith(prefix) || key.length() == prefix.length()) {
            return Optional.empty();
        }
        String name = key.substring(prefix.length());
        return name.contains(PATH_DELIMITER) ? Optional.empty() : Optional.of(name);
    }

    // =================================================================
    // SERVER CLASS PATHS
    // =================================================================

    /**
     * Get prefix for all server classes
     * Pattern: /<root>/serverclasses/
     */
    public String getServerClassesPrefix() {
        return String.join(PATH_DELIMITER, rootPrefix, PATH_SERVER_CLASSES) + PATH_DELIMITER;
    }

    /**
     * Pattern: /<root>/serverclasses/<namespace>/<name>
     */
    public String getServerClassPath(ServerClassKey key) {
        return getServerClassesPrefix() + key.getNamespace() + PATH_DELIMITER + key.getName();
    }

    /**
     * Extract the class key from a server class path, empty for anything else.
     */
    public Optional<ServerClassKey> parseServerClassKey(String key) {
        String prefix = getServerClassesPrefix();
        if (!key.startsWith(prefix)) {
            return Optional.empty();
        }
        String[] parts = key.substring(prefix.length()).split(PATH_DELIMITER);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ServerClassKey(parts[0], parts[1]));
    }

    // =================================================================
    // LEADER ELECTION PATHS
    // =================================================================

    /**
     * Pattern: /<root>/leader-election
     */
    public String getLeaderElectionKey() {
        return String.join(PATH_DELIMITER, rootPrefix, PATH_LEADER_ELECTION);
    }
}
