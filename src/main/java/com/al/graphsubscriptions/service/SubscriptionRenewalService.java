package com.al.graphsubscriptions.service;

import com.al.graphsubscriptions.config.SubscriptionProperties;
import com.al.graphsubscriptions.dto.RenewalOutcome;
import com.al.graphsubscriptions.dto.RenewalReport;
import com.al.graphsubscriptions.exception.GraphApiException;
import com.al.graphsubscriptions.exception.RegistryException;
import com.al.graphsubscriptions.model.Subscription;
import com.al.graphsubscriptions.model.enums.FailureKind;
import com.al.graphsubscriptions.model.enums.RenewalStatus;
import com.al.graphsubscriptions.service.auth.AccessToken;
import com.al.graphsubscriptions.service.auth.TokenProvider;
import com.al.graphsubscriptions.service.graph.GraphSubscriptionClient;
import com.al.graphsubscriptions.service.graph.RemoteSubscription;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The renewal pass shared by the timer and the on-demand endpoint.
 *
 * <p>
 * Candidates are processed one at a time under a single application credential. A provider "not found"
 * removes the local record; any other failure leaves the record untouched so the next pass retries it.
 * Only a failure to read the registry or to obtain the credential aborts the pass.
 */
@Service
@Slf4j
public class SubscriptionRenewalService {

    static final String MDC_KEY = "renewalPassId";

    private final SubscriptionRegistry registry;
    private final GraphSubscriptionClient subscriptionClient;
    private final TokenProvider tokenProvider;
    private final SubscriptionProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public SubscriptionRenewalService(SubscriptionRegistry registry,
            GraphSubscriptionClient subscriptionClient,
            TokenProvider tokenProvider,
            SubscriptionProperties properties,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.registry = registry;
        this.subscriptionClient = subscriptionClient;
        this.tokenProvider = tokenProvider;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public RenewalReport runRenewalPass() {
        return runRenewalPass(null);
    }

    /**
     * @param timeout stop starting new renewals once this much time has elapsed; null for no limit.
     *                Outcomes already recorded are kept and the report is marked incomplete.
     * @throws RegistryException if the candidate query fails
     * @throws com.al.graphsubscriptions.exception.TokenAcquisitionException if no application credential
     *         can be obtained
     */
    public RenewalReport runRenewalPass(Duration timeout) {
        String passId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_KEY, passId);
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Instant startedAt = clock.instant();
            Instant deadline = timeout != null ? startedAt.plus(timeout) : null;
            Instant lookaheadUntil = startedAt.plus(properties.getLookahead());

            log.info("Checking subscriptions expiring before {}", lookaheadUntil);
            List<Subscription> candidates = registry.findExpiringBefore(lookaheadUntil);

            RenewalReport report = RenewalReport.builder()
                    .passId(passId)
                    .startedAt(startedAt)
                    .lookaheadUntil(lookaheadUntil)
                    .candidates(candidates.size())
                    .complete(true)
                    .build();

            if (candidates.isEmpty()) {
                report.setMessage("No subscriptions to renew");
                return report;
            }
            log.info("Found {} subscription(s) to renew", candidates.size());

            AccessToken applicationToken = tokenProvider.getApplicationToken();

            for (int i = 0; i < candidates.size(); i++) {
                if (deadlineReached(deadline)) {
                    int remaining = candidates.size() - i;
                    log.warn("Renewal pass stopped at its deadline with {} subscription(s) unprocessed", remaining);
                    report.setComplete(false);
                    report.setUnprocessed(remaining);
                    break;
                }
                RenewalOutcome outcome = renew(candidates.get(i), applicationToken);
                meterRegistry.counter("graph.subscriptions.renewal", "outcome", outcome.getStatus().name())
                        .increment();
                report.getOutcomes().add(outcome);
            }

            log.info("Renewal pass finished: {} renewed, {} deleted, {} failed", report.getRenewedCount(),
                    report.getDeletedCount(), report.getFailedCount());
            return report;
        } finally {
            sample.stop(meterRegistry.timer("graph.subscriptions.renewal.pass"));
            MDC.remove(MDC_KEY);
        }
    }

    private boolean deadlineReached(Instant deadline) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    private RenewalOutcome renew(Subscription subscription, AccessToken applicationToken) {
        String subscriptionId = subscription.getSubscriptionId();
        RenewalOutcome.RenewalOutcomeBuilder outcome = RenewalOutcome.builder()
                .subscriptionId(subscriptionId)
                .resource(subscription.getResource())
                .previousExpiration(subscription.getExpirationDateTime());
        try {
            Instant requested = clock.instant().plus(properties.validityFor(subscription.resourceClass()));
            log.info("Renewing {} ({}) until {}", subscriptionId, subscription.getResource(), requested);

            RemoteSubscription remote;
            try {
                remote = subscriptionClient.renew(subscriptionId, requested, applicationToken);
            } catch (GraphApiException e) {
                if (e.getFailureKind() == FailureKind.NOT_FOUND) {
                    return deleteLocal(subscription, outcome);
                }
                log.error("Failed to renew {} ({}): {}", subscriptionId, e.getFailureKind(), e.getMessage());
                return outcome.status(RenewalStatus.FAILED)
                        .failureKind(e.getFailureKind())
                        .reason(e.getMessage())
                        .build();
            }

            Instant granted = remote.getExpirationDateTime() != null ? remote.getExpirationDateTime() : requested;
            try {
                registry.upsert(subscription.renewedUntil(granted, clock.instant()));
            } catch (RegistryException e) {
                // Renewed remotely but the stored expiration is stale; it stays a candidate and is renewed again.
                return outcome.status(RenewalStatus.FAILED)
                        .failureKind(FailureKind.REGISTRY)
                        .reason(e.getMessage())
                        .build();
            }

            log.info("Renewed subscription {} until {}", subscriptionId, granted);
            return outcome.status(RenewalStatus.RENEWED)
                    .newExpiration(granted)
                    .build();
        } catch (RuntimeException e) {
            log.error("Unexpected error renewing {}", subscriptionId, e);
            return outcome.status(RenewalStatus.FAILED)
                    .failureKind(FailureKind.UNEXPECTED)
                    .reason(e.getMessage())
                    .build();
        }
    }

    private RenewalOutcome deleteLocal(Subscription subscription, RenewalOutcome.RenewalOutcomeBuilder outcome) {
        String subscriptionId = subscription.getSubscriptionId();
        try {
            registry.deleteById(subscriptionId);
        } catch (RegistryException e) {
            return outcome.status(RenewalStatus.FAILED)
                    .failureKind(FailureKind.REGISTRY)
                    .reason(e.getMessage())
                    .build();
        }
        log.info("Deleted local subscription {}: no longer exists at the provider", subscriptionId);
        return outcome.status(RenewalStatus.DELETED)
                .failureKind(FailureKind.NOT_FOUND)
                .build();
    }
}
