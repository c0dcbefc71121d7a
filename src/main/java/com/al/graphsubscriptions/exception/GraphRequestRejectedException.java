package com.al.graphsubscriptions.exception;

import com.al.graphsubscriptions.model.enums.FailureKind;

/**
 * 4xx refusal other than not-found, e.g. missing permission or an invalid request body.
 */
public class GraphRequestRejectedException extends GraphApiException {

    public GraphRequestRejectedException(String message, int status, Throwable cause) {
        super(message, status, cause);
    }

    @Override
    public FailureKind getFailureKind() {
        return FailureKind.REJECTED;
    }
}
