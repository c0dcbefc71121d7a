package com.al.graphsubscriptions.dto;

import com.al.graphsubscriptions.model.enums.FailureKind;
import com.al.graphsubscriptions.model.enums.RenewalStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RenewalOutcome {
    private String subscriptionId;
    private String resource;
    private RenewalStatus status;
    private Instant previousExpiration;
    private Instant newExpiration;
    private FailureKind failureKind;
    private String reason;
}
