package com.al.graphsubscriptions.exception;

public class MissingCredentialException extends RuntimeException {

    public MissingCredentialException(String message) {
        super(message);
    }
}
