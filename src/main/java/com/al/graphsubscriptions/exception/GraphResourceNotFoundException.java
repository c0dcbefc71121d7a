package com.al.graphsubscriptions.exception;

import com.al.graphsubscriptions.model.enums.FailureKind;

public class GraphResourceNotFoundException extends GraphApiException {

    public GraphResourceNotFoundException(String message, Throwable cause) {
        super(message, 404, cause);
    }

    @Override
    public FailureKind getFailureKind() {
        return FailureKind.NOT_FOUND;
    }
}
