package com.al.graphsubscriptions.exception;

import com.al.graphsubscriptions.model.enums.FailureKind;
import lombok.Getter;

/**
 * Failure of a Graph call, classified so callers can decide between deleting, retrying later and giving up.
 */
@Getter
public abstract class GraphApiException extends RuntimeException {

    /** HTTP status, or 0 when no response was received. */
    private final int status;

    protected GraphApiException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public abstract FailureKind getFailureKind();

    public boolean isAuthorizationFailure() {
        return status == 401 || status == 403;
    }
}
