package com.al.graphsubscriptions.dto;

import com.al.graphsubscriptions.model.enums.ProvisionStatus;
import com.al.graphsubscriptions.model.enums.TeamEnumerationStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProvisionResult {
    private String userId;
    private String userPrincipalName;
    private TeamEnumerationStatus teamEnumeration;
    private String teamEnumerationReason;

    @Builder.Default
    private List<ProvisionOutcome> outcomes = new ArrayList<>();

    public long getCreatedCount() {
        return count(ProvisionStatus.CREATED);
    }

    public long getFailedCount() {
        return count(ProvisionStatus.FAILED);
    }

    private long count(ProvisionStatus status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }
}
