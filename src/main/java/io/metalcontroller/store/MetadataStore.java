package io.metalcontroller.store;

import io.metalcontroller.models.Server;
import io.metalcontroller.models.ServerClass;
import io.metalcontroller.models.ServerClassKey;
import io.metalcontroller.models.ServerClassStatus;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Abstraction over the declarative object store holding servers and server classes.
 * Reads may fail with an I/O error; status writes are guarded by a version token.
 */
public interface MetadataStore {

    // =================================================================
    // SERVER OPERATIONS
    // =================================================================

    /**
     * List every known server, accepted or not.
     */
    List<Server> listServers() throws Exception;

    // =================================================================
    // SERVER CLASS OPERATIONS
    // =================================================================

    /**
     * List every server class in every namespace.
     */
    List<ServerClass> listServerClasses() throws Exception;

    /**
     * Get a server class with its current version token set.
     */
    Optional<ServerClass> getServerClass(ServerClassKey key) throws Exception;

    /**
     * Replace the status of a server class if it is still at {@code resourceVersion}.
     *
     * @throws VersionConflictException if the class was modified since it was read
     * @throws ResourceNotFoundException if the class no longer exists
     */
    void patchServerClassStatus(ServerClassKey key, long resourceVersion, ServerClassStatus status) throws Exception;

    // =================================================================
    // WATCH OPERATIONS
    // =================================================================

    /**
     * Subscribe to server changes. The listener receives the name of the changed server.
     */
    Closeable watchServers(Consumer<String> onServerChange);

    /**
     * Subscribe to server class changes. The listener receives the key of the changed class.
     */
    Closeable watchServerClasses(Consumer<ServerClassKey> onServerClassChange);

    /**
     * Close/cleanup the metadata store
     */
    void close() throws Exception;
}
