package com.al.graphsubscriptions.service.graph;

import com.al.graphsubscriptions.config.GraphProperties;
import com.al.graphsubscriptions.exception.GraphApiException;
import com.al.graphsubscriptions.exception.GraphRequestRejectedException;
import com.al.graphsubscriptions.exception.GraphResourceNotFoundException;
import com.al.graphsubscriptions.exception.GraphTransientException;
import com.al.graphsubscriptions.model.enums.ChangeType;
import com.al.graphsubscriptions.model.enums.FailureKind;
import com.al.graphsubscriptions.service.auth.AccessToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class RestGraphClientTest {

    private static final String GRAPH = "https://graph.example.com/v1.0";
    private static final AccessToken TOKEN = AccessToken.of("token-1");

    private MockRestServiceServer server;
    private RestGraphClient client;

    @BeforeEach
    public void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        GraphProperties graphProperties = new GraphProperties();
        graphProperties.setBaseUrl(GRAPH);
        client = new RestGraphClient(restTemplate, graphProperties);
    }

    @Test
    public void testCreate_PostsSubscriptionAndReadsGrantedExpiration() {
        server.expect(requestTo(GRAPH + "/subscriptions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer token-1"))
                .andExpect(jsonPath("$.changeType").value("created,updated"))
                .andExpect(jsonPath("$.notificationUrl").value("https://hooks.example.com/webhook/teams"))
                .andExpect(jsonPath("$.resource").value("users/ada@contoso.com/chats/getAllMessages"))
                .andExpect(jsonPath("$.expirationDateTime").value("2026-10-19T12:55:00Z"))
                .andExpect(jsonPath("$.clientState").value("tag-1"))
                .andExpect(jsonPath("$.includeResourceData").value(false))
                .andRespond(withSuccess("{\"id\":\"sub-1\",\"resource\":\"users/ada@contoso.com/chats/getAllMessages\","
                        + "\"expirationDateTime\":\"2026-10-19T12:50:00.1234567Z\",\"clientState\":\"tag-1\"}",
                        MediaType.APPLICATION_JSON));

        RemoteSubscription remote = client.create(SubscriptionSpec.builder()
                .resource("users/ada@contoso.com/chats/getAllMessages")
                .notificationUrl("https://hooks.example.com/webhook/teams")
                .changeTypes(EnumSet.of(ChangeType.CREATED, ChangeType.UPDATED))
                .expiration(Instant.parse("2026-10-19T12:55:00Z"))
                .clientState("tag-1")
                .build(), TOKEN);

        assertEquals("sub-1", remote.getId());
        assertEquals(Instant.parse("2026-10-19T12:50:00.123456700Z"), remote.getExpirationDateTime());
        server.verify();
    }

    @Test
    public void testRenew_PatchesOnlyExpiration() {
        server.expect(requestTo(GRAPH + "/subscriptions/sub-1"))
                .andExpect(method(HttpMethod.PATCH))
                .andExpect(jsonPath("$.expirationDateTime").value("2026-10-19T13:40:00Z"))
                .andExpect(jsonPath("$.resource").doesNotExist())
                .andExpect(jsonPath("$.notificationUrl").doesNotExist())
                .andRespond(withSuccess("{\"id\":\"sub-1\",\"expirationDateTime\":\"2026-10-19T13:40:00Z\"}",
                        MediaType.APPLICATION_JSON));

        RemoteSubscription remote = client.renew("sub-1", Instant.parse("2026-10-19T13:40:00Z"), TOKEN);

        assertEquals(Instant.parse("2026-10-19T13:40:00Z"), remote.getExpirationDateTime());
        server.verify();
    }

    @Test
    public void testRenew_NotFound() {
        server.expect(requestTo(GRAPH + "/subscriptions/gone"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"code\":\"ResourceNotFound\"}}"));

        GraphApiException e = assertThrows(GraphResourceNotFoundException.class,
                () -> client.renew("gone", Instant.parse("2026-10-19T13:40:00Z"), TOKEN));

        assertEquals(FailureKind.NOT_FOUND, e.getFailureKind());
        assertTrue(e.getMessage().contains("ResourceNotFound"));
    }

    @Test
    public void testRenew_ThrottledIsTransient() {
        server.expect(requestTo(GRAPH + "/subscriptions/sub-1"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        GraphApiException e = assertThrows(GraphTransientException.class,
                () -> client.renew("sub-1", Instant.parse("2026-10-19T13:40:00Z"), TOKEN));

        assertEquals(429, e.getStatus());
    }

    @Test
    public void testRenew_TimeoutIsTransient() {
        server.expect(requestTo(GRAPH + "/subscriptions/sub-1"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        GraphApiException e = assertThrows(GraphTransientException.class,
                () -> client.renew("sub-1", Instant.parse("2026-10-19T13:40:00Z"), TOKEN));

        assertEquals(0, e.getStatus());
    }

    @Test
    public void testDelete_ForbiddenIsRejected() {
        server.expect(requestTo(GRAPH + "/subscriptions/sub-1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.FORBIDDEN));

        GraphApiException e = assertThrows(GraphRequestRejectedException.class, () -> client.delete("sub-1", TOKEN));

        assertTrue(e.isAuthorizationFailure());
    }

    @Test
    public void testDelete_Success() {
        server.expect(requestTo(GRAPH + "/subscriptions/sub-1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));

        assertDoesNotThrow(() -> client.delete("sub-1", TOKEN));
        server.verify();
    }

    @Test
    public void testGetMe() {
        server.expect(requestTo(GRAPH + "/me"))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer token-1"))
                .andRespond(withSuccess("{\"id\":\"aad-1\",\"userPrincipalName\":\"ada@contoso.com\","
                        + "\"displayName\":\"Ada\",\"mail\":\"ada@contoso.com\"}", MediaType.APPLICATION_JSON));

        GraphUser user = client.getMe(TOKEN);

        assertEquals("ada@contoso.com", user.getUserPrincipalName());
    }

    @Test
    public void testGetMe_MissingPrincipalNameIsRejected() {
        server.expect(requestTo(GRAPH + "/me"))
                .andRespond(withSuccess("{\"id\":\"aad-1\"}", MediaType.APPLICATION_JSON));

        assertThrows(GraphRequestRejectedException.class, () -> client.getMe(TOKEN));
    }

    @Test
    public void testListJoinedTeams_FollowsNextLink() {
        String nextLink = GRAPH + "/me/joinedTeams?$skiptoken=abc%3D%3D";
        server.expect(requestTo(GRAPH + "/me/joinedTeams"))
                .andRespond(withSuccess("{\"value\":[{\"id\":\"t1\",\"displayName\":\"Research\"}],"
                        + "\"@odata.nextLink\":\"" + nextLink + "\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(nextLink))
                .andRespond(withSuccess("{\"value\":[{\"id\":\"t2\",\"displayName\":\"Ops\"}]}",
                        MediaType.APPLICATION_JSON));

        List<GraphTeam> teams = client.listJoinedTeams(TOKEN);

        assertEquals(2, teams.size());
        assertEquals("t2", teams.get(1).getId());
        server.verify();
    }

    @Test
    public void testListJoinedTeams_NullValuePageIsEmpty() {
        server.expect(requestTo(GRAPH + "/me/joinedTeams"))
                .andRespond(withSuccess("{\"value\":null}", MediaType.APPLICATION_JSON));

        List<GraphTeam> teams = client.listJoinedTeams(TOKEN);

        assertTrue(teams.isEmpty());
        server.verify();
    }

    @Test
    public void testListJoinedTeams_GuestUnauthorized() {
        server.expect(requestTo(GRAPH + "/me/joinedTeams"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        GraphApiException e = assertThrows(GraphApiException.class, () -> client.listJoinedTeams(TOKEN));

        assertEquals(FailureKind.REJECTED, e.getFailureKind());
        assertTrue(e.isAuthorizationFailure());
    }

    @Test
    public void testCreate_ServerErrorIsTransient() {
        server.expect(requestTo(GRAPH + "/subscriptions"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThrows(GraphTransientException.class, () -> client.create(SubscriptionSpec.builder()
                .resource("users/ada@contoso.com/messages")
                .changeTypes(EnumSet.of(ChangeType.CREATED))
                .expiration(Instant.parse("2026-10-22T10:30:00Z"))
                .build(), TOKEN));
    }
}
