package com.al.graphsubscriptions.model.enums;

public enum TeamEnumerationStatus {
    ENUMERATED,
    SKIPPED_UNAUTHORIZED, // guest accounts cannot list joined teams
    FAILED
}
