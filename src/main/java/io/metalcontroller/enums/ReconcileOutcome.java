package io.metalcontroller.enums;

/**
 * Result of a successful reconcile.
 */
public enum ReconcileOutcome {
    /** The class no longer exists; nothing was done. */
    NOT_FOUND,
    /** The computed status equals the stored one; nothing was written. */
    UNCHANGED,
    /** A new status was written. */
    UPDATED;

    public String metricValue() {
        return name().toLowerCase();
    }
}
