package com.al.graphsubscriptions.service.graph;

import com.al.graphsubscriptions.model.enums.ChangeType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Set;

/**
 * What to subscribe to and for how long.
 */
@Data
@Builder
public class SubscriptionSpec {
    private String resource;
    private String notificationUrl;
    private Set<ChangeType> changeTypes;
    private Instant expiration;
    private String clientState;
}
