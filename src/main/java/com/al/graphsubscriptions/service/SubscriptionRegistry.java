package com.al.graphsubscriptions.service;

import com.al.graphsubscriptions.exception.RegistryException;
import com.al.graphsubscriptions.model.Subscription;
import com.al.graphsubscriptions.repository.SubscriptionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Data access for subscription records. Each call is a single-document operation; no business rules here.
 * Persistence errors surface as {@link RegistryException}.
 */
@Service
@Slf4j
public class SubscriptionRegistry {

    private final SubscriptionRepository subscriptionRepository;

    public SubscriptionRegistry(SubscriptionRepository subscriptionRepository) {
        this.subscriptionRepository = subscriptionRepository;
    }

    /**
     * Records expiring at or before the given instant, soonest first.
     */
    public List<Subscription> findExpiringBefore(Instant instant) {
        return call("find subscriptions expiring before " + instant,
                () -> subscriptionRepository.findByExpirationDateTimeLessThanEqualOrderByExpirationDateTimeAsc(instant));
    }

    public List<Subscription> findByUserId(String userId) {
        return call("find subscriptions for user " + userId, () -> subscriptionRepository.findByUserId(userId));
    }

    public Optional<Subscription> findById(String subscriptionId) {
        return call("find subscription " + subscriptionId, () -> subscriptionRepository.findById(subscriptionId));
    }

    /**
     * Stores a newly created subscription. Fails if the id is already present.
     */
    public Subscription insert(Subscription subscription) {
        return call("insert subscription " + subscription.getSubscriptionId(),
                () -> subscriptionRepository.insert(subscription));
    }

    public Subscription upsert(Subscription subscription) {
        return call("save subscription " + subscription.getSubscriptionId(),
                () -> subscriptionRepository.save(subscription));
    }

    public void deleteById(String subscriptionId) {
        call("delete subscription " + subscriptionId, () -> {
            subscriptionRepository.deleteById(subscriptionId);
            return null;
        });
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Registry failure: could not {}: {}", operation, e.getMessage());
            throw new RegistryException("Could not " + operation, e);
        }
    }
}
