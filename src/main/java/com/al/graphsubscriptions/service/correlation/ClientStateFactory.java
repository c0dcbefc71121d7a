package com.al.graphsubscriptions.service.correlation;

import java.util.Optional;

/**
 * Issues the opaque {@code clientState} the provider echoes on every notification, and resolves it back to
 * the owning user (and team).
 */
public interface ClientStateFactory {

    /**
     * Whether tags for this user fit the provider's clientState limit for every resource class.
     */
    boolean supportsUserId(String userId);

    String issue(NotificationOrigin origin);

    /**
     * @return the origin, or empty if the value was not issued by this factory
     */
    Optional<NotificationOrigin> resolve(String clientState);
}
