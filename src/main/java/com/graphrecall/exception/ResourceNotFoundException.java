package com.graphrecall.exception;

/**
 * Thrown when a user, entity or edge a caller refers to does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String resource, Object identifier) {
        super(String.format("%s '%s' not found", resource, identifier));
    }
}
