package io.metalcontroller.reconcile;

import io.metalcontroller.enums.ReconcilePhase;
import io.metalcontroller.models.ServerClassKey;
import io.metalcontroller.store.ResourceNotFoundException;
import lombok.Getter;

/**
 * Exception thrown when a reconcile ends in {@link ReconcilePhase#FAILED}.
 * Carries the phase that was running when the failure happened.
 */
@Getter
public class ReconcileException extends Exception {

    private final ServerClassKey key;
    private final ReconcilePhase failedPhase;

    public ReconcileException(ServerClassKey key, ReconcilePhase failedPhase, Throwable cause) {
        super("Reconcile of " + key + " failed while " + failedPhase + ": " + cause.getMessage(), cause);
        this.key = key;
        this.failedPhase = failedPhase;
    }

    /**
     * A class deleted between fetch and commit will not be found by a retry either.
     */
    public boolean isRetryable() {
        return !(getCause() instanceof ResourceNotFoundException);
    }
}
