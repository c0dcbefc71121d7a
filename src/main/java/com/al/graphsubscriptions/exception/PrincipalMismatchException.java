package com.al.graphsubscriptions.exception;

/**
 * The delegated credential belongs to someone other than the user subscriptions were requested for.
 */
public class PrincipalMismatchException extends RuntimeException {

    public PrincipalMismatchException(String message) {
        super(message);
    }
}
