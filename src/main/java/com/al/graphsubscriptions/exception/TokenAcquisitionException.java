package com.al.graphsubscriptions.exception;

/**
 * A delegated or application credential could not be obtained. Fatal to the enclosing operation.
 */
public class TokenAcquisitionException extends RuntimeException {

    public TokenAcquisitionException(String message) {
        super(message);
    }

    public TokenAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
