package io.metalcontroller.api.handlers;

import io.metalcontroller.api.models.responses.ErrorResponse;
import io.metalcontroller.models.ServerClass;
import io.metalcontroller.models.ServerClassKey;
import io.metalcontroller.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only REST API over server classes and their computed status.
 *
 * Supported operations:
 * - GET /serverclasses - All server classes
 * - GET /serverclasses/{namespace}/{name} - One server class
 */
@Slf4j
@RestController
@RequestMapping("/serverclasses")
public class ServerClassHandler {

    private final MetadataStore metadataStore;

    public ServerClassHandler(MetadataStore metadataStore) {
        this.metadataStore = metadataStore;
    }

    @GetMapping
    public ResponseEntity<Object> listServerClasses() {
        try {
            List<ServerClass> serverClasses = new ArrayList<>(metadataStore.listServerClasses());
            serverClasses.sort(Comparator.comparing(ServerClass::getNamespace)
                    .thenComparing(ServerClass::getName));
            return ResponseEntity.ok(serverClasses);
        } catch (Exception e) {
            log.error("Error listing server classes: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/{namespace}/{name}")
    public ResponseEntity<Object> getServerClass(@PathVariable String namespace, @PathVariable String name) {
        ServerClassKey key = new ServerClassKey(namespace, name);
        try {
            Optional<ServerClass> serverClass = metadataStore.getServerClass(key);
            if (serverClass.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Server class " + key));
            }
            return ResponseEntity.ok(serverClass.get());
        } catch (Exception e) {
            log.error("Error getting server class '{}': {}", key, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}
