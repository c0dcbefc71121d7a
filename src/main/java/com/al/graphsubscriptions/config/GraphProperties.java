package com.al.graphsubscriptions.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Connection settings for Microsoft Graph and the identity platform.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.graph")
public class GraphProperties {

    /**
     * Graph API root, without trailing slash.
     */
    private String baseUrl = "https://graph.microsoft.com/v1.0";

    /**
     * Identity platform authority used for the client-credentials grant.
     */
    private String loginUrl = "https://login.microsoftonline.com";

    private String tenantId;

    private String clientId;

    private String clientSecret;

    private String scope = "https://graph.microsoft.com/.default";

    private Duration connectTimeout = Duration.ofSeconds(3);

    /**
     * Upper bound for a single Graph call, so one unresponsive request cannot stall a renewal pass.
     */
    private Duration readTimeout = Duration.ofSeconds(5);

    /**
     * Application tokens are refreshed this long before they expire.
     */
    private Duration tokenRefreshSkew = Duration.ofMinutes(5);
}
