package com.al.graphsubscriptions.model.enums;

/**
 * Why a single subscription operation did not succeed.
 */
public enum FailureKind {
    /** Remote subscription or resource no longer exists. */
    NOT_FOUND,
    /** Rate limit, network error, timeout or 5xx. Safe to retry later. */
    TRANSIENT,
    /** Remote refusal other than not-found (permissions, validation). */
    REJECTED,
    /** The remote call succeeded but the local write failed. */
    REGISTRY,
    UNEXPECTED
}
