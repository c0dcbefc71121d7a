package com.al.graphsubscriptions.config;

import com.al.graphsubscriptions.model.enums.ResourceClass;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Subscription lifecycle policy: validity windows, renewal cadence and correlation settings.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.subscriptions")
@Validated
public class SubscriptionProperties {

    /**
     * Public base URL the provider posts notifications to. Per-class paths are appended.
     */
    @NotBlank
    private String notificationBaseUrl;

    /**
     * Requested validity for chat and channel message subscriptions. The provider caps these near one hour.
     */
    private Duration chatValidity = Duration.ofMinutes(55);

    /**
     * Requested validity for mail subscriptions (just under the provider's three-day maximum).
     */
    private Duration mailValidity = Duration.ofMinutes(4230);

    /**
     * Subscriptions expiring within this window are renewal candidates.
     */
    private Duration lookahead = Duration.ofMinutes(45);

    private Duration renewalInterval = Duration.ofMinutes(30);

    /**
     * Delay before the first scheduled renewal pass after startup.
     */
    private Duration initialDelay = Duration.ofMinutes(1);

    /**
     * Default time budget for an externally triggered renewal pass.
     */
    private Duration onDemandTimeout = Duration.ofSeconds(50);

    /**
     * Maximum concurrent team-channel creations during provisioning.
     */
    @Min(1)
    private int teamConcurrency = 3;

    @NotBlank
    private String clientStateSecret;

    private String changeTypes = "created,updated";

    public Duration validityFor(ResourceClass resourceClass) {
        return resourceClass.isLongLived() ? mailValidity : chatValidity;
    }

    /**
     * Base URL with any trailing slash removed; the provider's validation handshake fails on redirects.
     */
    public String normalizedNotificationBaseUrl() {
        if (notificationBaseUrl == null || notificationBaseUrl.isBlank()) {
            throw new IllegalStateException("app.subscriptions.notification-base-url is not set");
        }
        String url = notificationBaseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
