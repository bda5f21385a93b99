package com.graphrecall.exception;

/**
 * Failure of the external language-model service: transport error,
 * error status, or a response that cannot be used.
 */
public class GatewayException extends RuntimeException {

    private final String operation;

    public GatewayException(String operation, String message) {
        super(operation + " failed: " + message);
        this.operation = operation;
    }

    public GatewayException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
