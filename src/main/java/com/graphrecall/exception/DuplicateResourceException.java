package com.graphrecall.exception;

/**
 * Thrown when registering a user whose username is already taken.
 * Graph records never raise this: their uniqueness conflicts are resolved by re-reading.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String resource, String identifier) {
        super(String.format("%s '%s' already exists", resource, identifier));
    }
}
