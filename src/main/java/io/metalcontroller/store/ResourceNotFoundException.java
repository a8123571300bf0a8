package io.metalcontroller.store;

/**
 * Thrown when a write targets a record that does not exist.
 */
public class ResourceNotFoundException extends Exception {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
