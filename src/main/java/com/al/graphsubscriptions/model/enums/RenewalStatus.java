package com.al.graphsubscriptions.model.enums;

public enum RenewalStatus {
    RENEWED,
    DELETED, // remote subscription was gone, local record removed
    FAILED
}
