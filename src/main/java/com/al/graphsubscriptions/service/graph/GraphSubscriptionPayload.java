package com.al.graphsubscriptions.service.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Graph {@code subscription} resource as sent and received on the wire.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphSubscriptionPayload {
    private String id;
    private String changeType; // "created,updated"
    private String notificationUrl;
    private String resource;
    private String expirationDateTime; // ISO-8601, UTC
    private String clientState;
    private Boolean includeResourceData;
}
