package com.al.graphsubscriptions.exception;

import com.al.graphsubscriptions.model.enums.FailureKind;

/**
 * Rate limiting, timeouts, connection errors and 5xx responses.
 */
public class GraphTransientException extends GraphApiException {

    public GraphTransientException(String message, int status, Throwable cause) {
        super(message, status, cause);
    }

    @Override
    public FailureKind getFailureKind() {
        return FailureKind.TRANSIENT;
    }
}
