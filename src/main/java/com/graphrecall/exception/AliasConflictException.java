package com.graphrecall.exception;

/**
 * Raised when an alias would join entities owned by different users.
 */
public class AliasConflictException extends RuntimeException {

    public AliasConflictException(String message) {
        super(message);
    }
}
