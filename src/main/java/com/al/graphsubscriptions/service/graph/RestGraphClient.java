package com.al.graphsubscriptions.service.graph;

import com.al.graphsubscriptions.config.GraphProperties;
import com.al.graphsubscriptions.exception.GraphRequestRejectedException;
import com.al.graphsubscriptions.model.enums.ChangeType;
import com.al.graphsubscriptions.service.auth.AccessToken;
import com.al.graphsubscriptions.util.DateTimeUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * RestTemplate-backed Graph client. Timeouts come from the shared RestTemplate configuration.
 */
@Component
@Slf4j
public class RestGraphClient implements GraphSubscriptionClient, GraphDirectoryClient {

    private static final ParameterizedTypeReference<GraphCollection<GraphTeam>> TEAM_PAGE =
            new ParameterizedTypeReference<GraphCollection<GraphTeam>>() {
            };

    private final RestTemplate restTemplate;
    private final GraphProperties graphProperties;

    public RestGraphClient(RestTemplate restTemplate, GraphProperties graphProperties) {
        this.restTemplate = restTemplate;
        this.graphProperties = graphProperties;
    }

    @Override
    public RemoteSubscription create(SubscriptionSpec spec, AccessToken credential) {
        GraphSubscriptionPayload body = GraphSubscriptionPayload.builder()
                .changeType(ChangeType.format(spec.getChangeTypes()))
                .notificationUrl(spec.getNotificationUrl())
                .resource(spec.getResource())
                .expirationDateTime(DateTimeUtil.formatForGraph(spec.getExpiration()))
                .clientState(spec.getClientState())
                .includeResourceData(false)
                .build();

        log.debug("Creating subscription for {} until {}", spec.getResource(), body.getExpirationDateTime());
        GraphSubscriptionPayload created = exchange("Create subscription for " + spec.getResource(),
                url("/subscriptions"), HttpMethod.POST, body, credential);
        return toRemote(created);
    }

    @Override
    public RemoteSubscription renew(String subscriptionId, Instant newExpiration, AccessToken credential) {
        GraphSubscriptionPayload body = GraphSubscriptionPayload.builder()
                .expirationDateTime(DateTimeUtil.formatForGraph(newExpiration))
                .build();

        GraphSubscriptionPayload renewed = exchange("Renew subscription " + subscriptionId,
                url("/subscriptions/" + subscriptionId), HttpMethod.PATCH, body, credential);
        return toRemote(renewed);
    }

    @Override
    public void delete(String subscriptionId, AccessToken credential) {
        try {
            restTemplate.exchange(url("/subscriptions/" + subscriptionId), HttpMethod.DELETE,
                    new HttpEntity<>(headers(credential)), Void.class);
        } catch (RestClientException e) {
            throw GraphErrorClassifier.classify("Delete subscription " + subscriptionId, e);
        }
    }

    @Override
    public GraphUser getMe(AccessToken delegated) {
        try {
            ResponseEntity<GraphUser> response = restTemplate.exchange(url("/me"), HttpMethod.GET,
                    new HttpEntity<>(headers(delegated)), GraphUser.class);
            GraphUser user = response.getBody();
            if (user == null || user.getUserPrincipalName() == null) {
                throw new GraphRequestRejectedException("/me returned no userPrincipalName",
                        response.getStatusCode().value(), null);
            }
            return user;
        } catch (RestClientException e) {
            throw GraphErrorClassifier.classify("Resolve signed-in user", e);
        }
    }

    @Override
    public List<GraphTeam> listJoinedTeams(AccessToken delegated) {
        List<GraphTeam> teams = new ArrayList<>();
        URI next = URI.create(url("/me/joinedTeams"));
        try {
            while (next != null) {
                // nextLink is already encoded; a URI avoids template expansion
                ResponseEntity<GraphCollection<GraphTeam>> response = restTemplate.exchange(next, HttpMethod.GET,
                        new HttpEntity<>(headers(delegated)), TEAM_PAGE);
                GraphCollection<GraphTeam> page = response.getBody();
                if (page == null) {
                    break;
                }
                if (page.getValue() != null) {
                    teams.addAll(page.getValue());
                }
                next = page.getNextLink() != null ? URI.create(page.getNextLink()) : null;
            }
        } catch (RestClientException e) {
            throw GraphErrorClassifier.classify("List joined teams", e);
        }
        return teams;
    }

    private GraphSubscriptionPayload exchange(String operation, String url, HttpMethod method,
            GraphSubscriptionPayload body, AccessToken credential) {
        HttpHeaders headers = headers(credential);
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<GraphSubscriptionPayload> response = restTemplate.exchange(url, method,
                    new HttpEntity<>(body, headers), GraphSubscriptionPayload.class);
            if (response.getBody() == null) {
                throw new GraphRequestRejectedException(operation + " returned an empty body",
                        response.getStatusCode().value(), null);
            }
            return response.getBody();
        } catch (RestClientException e) {
            throw GraphErrorClassifier.classify(operation, e);
        }
    }

    private RemoteSubscription toRemote(GraphSubscriptionPayload payload) {
        Instant expiration;
        try {
            expiration = DateTimeUtil.parseGraphTimestamp(payload.getExpirationDateTime());
        } catch (DateTimeParseException e) {
            throw new GraphRequestRejectedException(
                    "Unparseable expirationDateTime: " + payload.getExpirationDateTime(), 200, e);
        }
        return RemoteSubscription.builder()
                .id(payload.getId())
                .resource(payload.getResource())
                .expirationDateTime(expiration)
                .clientState(payload.getClientState())
                .build();
    }

    private HttpHeaders headers(AccessToken credential) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, credential.asAuthorizationHeader());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private String url(String path) {
        return graphProperties.getBaseUrl() + path;
    }
}
