package com.al.graphsubscriptions.model;

import com.al.graphsubscriptions.model.enums.ChangeType;
import com.al.graphsubscriptions.model.enums.ResourceClass;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Set;

/**
 * Local record of a remote change-notification subscription. A record exists only while the remote
 * subscription is believed to exist.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "subscriptions")
public class Subscription {

    /** Provider-assigned identifier. */
    @Id
    private String subscriptionId;

    @Indexed
    private String userId;

    // Only set for team-channel subscriptions
    private String teamId;
    private String teamName;

    private String resource;
    private Set<ChangeType> changeType;
    private String clientState;

    @Indexed
    private Instant expirationDateTime;

    private Instant createdAt;
    private Instant lastRenewedAt;

    public ResourceClass resourceClass() {
        return ResourceClass.fromResource(resource);
    }

    /**
     * Copy with a new expiration. The watched resource never changes on renewal.
     */
    public Subscription renewedUntil(Instant expiration, Instant renewedAt) {
        return toBuilder()
                .expirationDateTime(expiration)
                .lastRenewedAt(renewedAt)
                .build();
    }
}
