package com.al.graphsubscriptions.service.auth;

import com.al.graphsubscriptions.config.GraphProperties;
import com.al.graphsubscriptions.exception.TokenAcquisitionException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Obtains the application token with the OAuth2 client-credentials grant and keeps it until shortly before
 * it expires. Delegated tokens are whatever the signed-in client presented.
 */
@Service
@Slf4j
public class ClientCredentialsTokenProvider implements TokenProvider {

    private final RestTemplate restTemplate;
    private final GraphProperties graphProperties;
    private final Clock clock;

    private volatile AccessToken cachedApplicationToken;

    public ClientCredentialsTokenProvider(RestTemplate restTemplate, GraphProperties graphProperties, Clock clock) {
        this.restTemplate = restTemplate;
        this.graphProperties = graphProperties;
        this.clock = clock;
    }

    @Override
    public AccessToken getDelegatedToken(UserSession session) {
        if (session == null || session.getBearerToken() == null || session.getBearerToken().isBlank()) {
            throw new TokenAcquisitionException("No delegated credential in user session");
        }
        return AccessToken.of(session.getBearerToken().trim());
    }

    @Override
    public AccessToken getApplicationToken() {
        Instant refreshBefore = clock.instant().plus(graphProperties.getTokenRefreshSkew());
        AccessToken cached = cachedApplicationToken;
        if (cached != null && cached.isUsableAt(refreshBefore)) {
            return cached;
        }
        // Not locked: callers racing on an expired token may each fetch one, the last one wins the cache
        AccessToken fresh = requestApplicationToken();
        cachedApplicationToken = fresh;
        return fresh;
    }

    private AccessToken requestApplicationToken() {
        if (graphProperties.getTenantId() == null || graphProperties.getClientId() == null
                || graphProperties.getClientSecret() == null) {
            throw new TokenAcquisitionException("Graph application credentials are not configured");
        }

        String url = graphProperties.getLoginUrl() + "/" + graphProperties.getTenantId() + "/oauth2/v2.0/token";

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", graphProperties.getClientId());
        form.add("client_secret", graphProperties.getClientSecret());
        form.add("scope", graphProperties.getScope());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            TokenResponse response = restTemplate.postForObject(url, new HttpEntity<>(form, headers),
                    TokenResponse.class);
            if (response == null || response.getAccessToken() == null) {
                throw new TokenAcquisitionException("Token endpoint returned no access token");
            }
            Instant expiresAt = clock.instant().plusSeconds(response.getExpiresIn());
            log.info("Acquired application token, expires at {}", expiresAt);
            return new AccessToken(response.getAccessToken(), expiresAt);
        } catch (RestClientException e) {
            log.error("Application token request failed: {}", e.getMessage());
            throw new TokenAcquisitionException("Could not acquire application token", e);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TokenResponse {
        @JsonProperty("access_token")
        private String accessToken;

        @JsonProperty("expires_in")
        private long expiresIn;

        @JsonProperty("token_type")
        private String tokenType;
    }
}
