package com.al.graphsubscriptions.config;

import com.al.graphsubscriptions.model.enums.ResourceClass;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class SubscriptionPropertiesTest {

    @Test
    public void testDefaults() {
        SubscriptionProperties properties = new SubscriptionProperties();

        assertEquals(Duration.ofMinutes(55), properties.validityFor(ResourceClass.CHAT_MESSAGES));
        assertEquals(Duration.ofMinutes(55), properties.validityFor(ResourceClass.CHANNEL_MESSAGES));
        assertEquals(Duration.ofMinutes(4230), properties.validityFor(ResourceClass.MAIL_MESSAGES));
        assertEquals(Duration.ofMinutes(45), properties.getLookahead());
        assertEquals(Duration.ofMinutes(30), properties.getRenewalInterval());
        assertEquals(3, properties.getTeamConcurrency());
    }

    @Test
    public void testNormalizedNotificationBaseUrl_StripsTrailingSlashes() {
        SubscriptionProperties properties = new SubscriptionProperties();
        properties.setNotificationBaseUrl(" https://hooks.example.com// ");

        assertEquals("https://hooks.example.com", properties.normalizedNotificationBaseUrl());
    }

    @Test
    public void testNormalizedNotificationBaseUrl_RequiresValue() {
        assertThrows(IllegalStateException.class, () -> new SubscriptionProperties().normalizedNotificationBaseUrl());
    }
}
