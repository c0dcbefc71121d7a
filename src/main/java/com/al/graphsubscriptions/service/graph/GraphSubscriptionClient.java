package com.al.graphsubscriptions.service.graph;

import com.al.graphsubscriptions.exception.GraphApiException;
import com.al.graphsubscriptions.service.auth.AccessToken;

import java.time.Instant;

/**
 * Create, renew and delete operations of the Graph subscriptions API. Every failure surfaces as a
 * {@link GraphApiException} subclass carrying its classification.
 */
public interface GraphSubscriptionClient {

    RemoteSubscription create(SubscriptionSpec spec, AccessToken credential);

    RemoteSubscription renew(String subscriptionId, Instant newExpiration, AccessToken credential);

    void delete(String subscriptionId, AccessToken credential);
}
