package com.al.graphsubscriptions.dto;

import com.al.graphsubscriptions.model.enums.FailureKind;
import com.al.graphsubscriptions.model.enums.ProvisionStatus;
import com.al.graphsubscriptions.model.enums.ResourceClass;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of one creation attempt: one resource class, or one team for channel subscriptions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProvisionOutcome {
    private ResourceClass resourceClass;
    private String teamId;
    private String teamName;
    private ProvisionStatus status;

    // Set when CREATED
    private String subscriptionId;
    private Instant expirationDateTime;

    // Set when FAILED
    private FailureKind failureKind;
    private String reason;

    public boolean isCreated() {
        return status == ProvisionStatus.CREATED;
    }
}
