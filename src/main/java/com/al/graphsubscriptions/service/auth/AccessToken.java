package com.al.graphsubscriptions.service.auth;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Instant;

/**
 * Opaque bearer credential. Never inspected beyond being passed to Graph.
 */
@Getter
@EqualsAndHashCode
public final class AccessToken {

    private final String value;

    /** Null when the issuer did not say. */
    private final Instant expiresAt;

    public AccessToken(String value, Instant expiresAt) {
        this.value = value;
        this.expiresAt = expiresAt;
    }

    public static AccessToken of(String value) {
        return new AccessToken(value, null);
    }

    public boolean isUsableAt(Instant instant) {
        return expiresAt == null || instant.isBefore(expiresAt);
    }

    public String asAuthorizationHeader() {
        return "Bearer " + value;
    }

    @Override
    public String toString() {
        return "AccessToken[expiresAt=" + expiresAt + "]";
    }
}
