package io.metalcontroller.store;

/**
 * Thrown when a guarded write finds the record at a different version than the caller read.
 */
public class VersionConflictException extends Exception {

    public VersionConflictException(String message) {
        super(message);
    }
}
