package com.al.graphsubscriptions.service.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Subscription as acknowledged by the provider. The granted expiration may be earlier than requested.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemoteSubscription {
    private String id;
    private String resource;
    private Instant expirationDateTime;
    private String clientState;
}
