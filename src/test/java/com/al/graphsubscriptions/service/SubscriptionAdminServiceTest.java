package com.al.graphsubscriptions.service;

import com.al.graphsubscriptions.dto.RetirementOutcome;
import com.al.graphsubscriptions.exception.GraphResourceNotFoundException;
import com.al.graphsubscriptions.exception.GraphTransientException;
import com.al.graphsubscriptions.model.Subscription;
import com.al.graphsubscriptions.model.enums.FailureKind;
import com.al.graphsubscriptions.service.auth.AccessToken;
import com.al.graphsubscriptions.service.auth.TokenProvider;
import com.al.graphsubscriptions.service.graph.GraphSubscriptionClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class SubscriptionAdminServiceTest {

    private static final AccessToken APP_TOKEN = AccessToken.of("app-token");

    @Mock
    private GraphSubscriptionClient subscriptionClient;

    @Mock
    private TokenProvider tokenProvider;

    private InMemorySubscriptionRegistry registry;
    private SubscriptionAdminService adminService;

    @BeforeEach
    public void setUp() {
        registry = new InMemorySubscriptionRegistry();
        adminService = new SubscriptionAdminService(registry, subscriptionClient, tokenProvider);
        registry.add(record("chat-1", "user-1"));
        registry.add(record("mail-1", "user-1"));
        registry.add(record("chat-2", "user-2"));
    }

    @Test
    public void testListForUser_ReturnsOnlyThatUser() {
        List<Subscription> subscriptions = adminService.listForUser("user-1");

        assertEquals(2, subscriptions.size());
        assertTrue(subscriptions.stream().allMatch(s -> "user-1".equals(s.getUserId())));
    }

    @Test
    public void testRetireForUser_DeletesRemoteThenLocal() {
        when(tokenProvider.getApplicationToken()).thenReturn(APP_TOKEN);

        List<RetirementOutcome> outcomes = adminService.retireForUser("user-1");

        assertEquals(2, outcomes.size());
        assertTrue(outcomes.stream().allMatch(RetirementOutcome::isDeleted));
        verify(subscriptionClient).delete("chat-1", APP_TOKEN);
        verify(subscriptionClient).delete("mail-1", APP_TOKEN);
        assertEquals(1, registry.snapshot().size());
        assertTrue(registry.findById("chat-2").isPresent());
    }

    @Test
    public void testRetireForUser_RemoteAlreadyGoneStillRemovesRecord() {
        when(tokenProvider.getApplicationToken()).thenReturn(APP_TOKEN);
        doThrow(new GraphResourceNotFoundException("404", null)).when(subscriptionClient).delete("chat-1", APP_TOKEN);

        List<RetirementOutcome> outcomes = adminService.retireForUser("user-1");

        assertTrue(outcomes.get(0).isDeleted());
        assertFalse(registry.findById("chat-1").isPresent());
    }

    @Test
    public void testRetireForUser_RemoteFailureKeepsRecord() {
        when(tokenProvider.getApplicationToken()).thenReturn(APP_TOKEN);
        lenient().doThrow(new GraphTransientException("503", 503, null)).when(subscriptionClient).delete("mail-1", APP_TOKEN);

        List<RetirementOutcome> outcomes = adminService.retireForUser("user-1");

        RetirementOutcome mail = outcomes.get(1);
        assertFalse(mail.isDeleted());
        assertEquals(FailureKind.TRANSIENT, mail.getFailureKind());
        assertTrue(registry.findById("mail-1").isPresent());
        assertFalse(registry.findById("chat-1").isPresent());
    }

    @Test
    public void testRetireForUser_NoSubscriptionsNeedsNoToken() {
        List<RetirementOutcome> outcomes = adminService.retireForUser("nobody");

        assertTrue(outcomes.isEmpty());
        verifyNoInteractions(tokenProvider, subscriptionClient);
    }

    private static Subscription record(String id, String userId) {
        return Subscription.builder()
                .subscriptionId(id)
                .userId(userId)
                .resource(id.startsWith("mail") ? "users/a@contoso.com/messages"
                        : "users/a@contoso.com/chats/getAllMessages")
                .expirationDateTime(Instant.parse("2026-10-19T13:00:00Z"))
                .build();
    }
}
