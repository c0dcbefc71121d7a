package com.al.graphsubscriptions.service;

import com.al.graphsubscriptions.dto.RetirementOutcome;
import com.al.graphsubscriptions.exception.GraphApiException;
import com.al.graphsubscriptions.exception.RegistryException;
import com.al.graphsubscriptions.model.Subscription;
import com.al.graphsubscriptions.model.enums.FailureKind;
import com.al.graphsubscriptions.service.auth.AccessToken;
import com.al.graphsubscriptions.service.auth.TokenProvider;
import com.al.graphsubscriptions.service.graph.GraphSubscriptionClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator actions on a user's subscriptions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SubscriptionAdminService {

    private final SubscriptionRegistry registry;
    private final GraphSubscriptionClient subscriptionClient;
    private final TokenProvider tokenProvider;

    public List<Subscription> listForUser(String userId) {
        return registry.findByUserId(userId);
    }

    /**
     * Deletes every subscription of the user, remotely first. A remote "not found" still removes the local
     * record; any other remote failure keeps it so the two sides stay consistent.
     */
    public List<RetirementOutcome> retireForUser(String userId) {
        List<Subscription> subscriptions = registry.findByUserId(userId);
        List<RetirementOutcome> outcomes = new ArrayList<>();
        if (subscriptions.isEmpty()) {
            return outcomes;
        }

        AccessToken applicationToken = tokenProvider.getApplicationToken();
        log.info("Retiring {} subscription(s) for user {}", subscriptions.size(), userId);

        for (Subscription subscription : subscriptions) {
            outcomes.add(retire(subscription, applicationToken));
        }
        return outcomes;
    }

    private RetirementOutcome retire(Subscription subscription, AccessToken applicationToken) {
        String subscriptionId = subscription.getSubscriptionId();
        RetirementOutcome.RetirementOutcomeBuilder outcome = RetirementOutcome.builder()
                .subscriptionId(subscriptionId)
                .resource(subscription.getResource());
        try {
            subscriptionClient.delete(subscriptionId, applicationToken);
        } catch (GraphApiException e) {
            if (e.getFailureKind() != FailureKind.NOT_FOUND) {
                log.error("Could not delete remote subscription {}: {}", subscriptionId, e.getMessage());
                return outcome.deleted(false).failureKind(e.getFailureKind()).reason(e.getMessage()).build();
            }
            log.info("Remote subscription {} was already gone", subscriptionId);
        }

        try {
            registry.deleteById(subscriptionId);
        } catch (RegistryException e) {
            return outcome.deleted(false).failureKind(FailureKind.REGISTRY).reason(e.getMessage()).build();
        }
        return outcome.deleted(true).build();
    }
}
