package com.al.graphsubscriptions.exception;

/**
 * Persistence failure in the subscription registry.
 */
public class RegistryException extends RuntimeException {

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
