package com.al.graphsubscriptions.repository;

import com.al.graphsubscriptions.model.Subscription;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface SubscriptionRepository extends MongoRepository<Subscription, String> {

    List<Subscription> findByExpirationDateTimeLessThanEqualOrderByExpirationDateTimeAsc(Instant instant);

    List<Subscription> findByUserId(String userId);
}
