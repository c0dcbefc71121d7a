package com.al.graphsubscriptions.dto;

import com.al.graphsubscriptions.model.enums.RenewalStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one renewal pass. {@code complete} is false when the pass stopped early at its deadline;
 * {@code unprocessed} candidates are left for the next pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RenewalReport {
    private String passId;
    private Instant startedAt;
    private Instant lookaheadUntil;
    private int candidates;
    private boolean complete;
    private int unprocessed;
    private String message;

    @Builder.Default
    private List<RenewalOutcome> outcomes = new ArrayList<>();

    public long getRenewedCount() {
        return count(RenewalStatus.RENEWED);
    }

    public long getDeletedCount() {
        return count(RenewalStatus.DELETED);
    }

    public long getFailedCount() {
        return count(RenewalStatus.FAILED);
    }

    private long count(RenewalStatus status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }
}
