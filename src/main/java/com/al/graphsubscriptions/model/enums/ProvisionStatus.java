package com.al.graphsubscriptions.model.enums;

public enum ProvisionStatus {
    CREATED,
    FAILED
}
