package io.metalcontroller.api.handlers;

import io.metalcontroller.ServerClassController;
import io.metalcontroller.api.models.responses.ControllerHealthResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reports leadership and work queue state of this controller replica.
 * GET /_controller/health
 */
@RestController
public class ControllerHealthHandler {

    private final ServerClassController controller;
    private final String controllerId;

    public ControllerHealthHandler(ServerClassController controller, @Value("${controller.id}") String controllerId) {
        this.controller = controller;
        this.controllerId = controllerId;
    }

    @GetMapping("/_controller/health")
    public ResponseEntity<ControllerHealthResponse> health() {
        return ResponseEntity.ok(ControllerHealthResponse.builder()
                .controllerId(controllerId)
                .leader(controller.isLeader())
                .reconciling(controller.isReconciling())
                .queueDepth(controller.getQueueDepth())
                .build());
    }
}
