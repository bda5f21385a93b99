package com.graphrecall.exception;

/**
 * Raised when an entity kept changing underneath a read-modify-write and the
 * update gave up retrying.
 */
public class StaleEntityException extends RuntimeException {

    public StaleEntityException(String entityName) {
        super("Entity '" + entityName + "' was modified concurrently");
    }
}
