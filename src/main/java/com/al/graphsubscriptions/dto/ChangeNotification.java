package com.al.graphsubscriptions.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a Graph change-notification batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChangeNotification {
    private String subscriptionId;
    private String clientState;
    private String changeType;
    private String resource;
    private String tenantId;
    private String subscriptionExpirationDateTime;
    private JsonNode resourceData;
}
