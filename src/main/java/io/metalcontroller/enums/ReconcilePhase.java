package io.metalcontroller.enums;

/**
 * Phases of a single server class reconcile, entered strictly in declaration order.
 * {@link #FAILED} may be entered from any phase before {@link #DONE}.
 */
public enum ReconcilePhase {
    FETCHING,
    FILTERING,
    AGGREGATING,
    COMMITTING,
    DONE,
    FAILED
}
