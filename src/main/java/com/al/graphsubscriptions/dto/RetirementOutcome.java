package com.al.graphsubscriptions.dto;

import com.al.graphsubscriptions.model.enums.FailureKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetirementOutcome {
    private String subscriptionId;
    private String resource;
    private boolean deleted;
    private FailureKind failureKind;
    private String reason;
}
