package com.al.graphsubscriptions.dto;

import com.al.graphsubscriptions.model.enums.ResourceClass;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A verified notification, attributed to its owner, as published for downstream consumers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RelayedNotification {
    private String userId;
    private String teamId;
    private ResourceClass resourceClass;
    private String subscriptionId;
    private String changeType;
    private String resource;
    private JsonNode resourceData;
    private LocalDateTime receivedAt;
}
