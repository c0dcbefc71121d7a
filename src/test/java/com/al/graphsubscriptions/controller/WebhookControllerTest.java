package com.al.graphsubscriptions.controller;

import com.al.graphsubscriptions.dto.ChangeNotificationCollection;
import com.al.graphsubscriptions.exception.GlobalExceptionHandler;
import com.al.graphsubscriptions.model.enums.ResourceClass;
import com.al.graphsubscriptions.service.NotificationRelayService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class WebhookControllerTest {

    private static final String BATCH = "{\"value\":[{\"subscriptionId\":\"sub-1\",\"clientState\":\"v1.mail.x..y\","
            + "\"changeType\":\"created\",\"resource\":\"Users/abc/Messages/def\","
            + "\"resourceData\":{\"id\":\"def\"},\"tenantId\":\"tenant-1\"}]}";

    @Mock
    private NotificationRelayService relayService;

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new WebhookController(relayService, new ObjectMapper()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    public void testValidationHandshake_EchoesTokenAsPlainText() throws Exception {
        mockMvc.perform(post("/webhook/teams-channels")
                        .param("validationToken", "Validation: Testing client application reachability")
                        .contentType(MediaType.TEXT_PLAIN))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("Validation: Testing client application reachability"));

        verifyNoInteractions(relayService);
    }

    @Test
    public void testNotificationBatch_RelayedForEndpointClass() throws Exception {
        mockMvc.perform(post("/webhook/outlook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BATCH))
                .andExpect(status().isAccepted());

        ArgumentCaptor<ChangeNotificationCollection> batch = ArgumentCaptor.forClass(ChangeNotificationCollection.class);
        verify(relayService).relay(eq(ResourceClass.MAIL_MESSAGES), batch.capture());
        assertEquals("sub-1", batch.getValue().getValue().get(0).getSubscriptionId());
        assertEquals("def", batch.getValue().getValue().get(0).getResourceData().get("id").asText());
    }

    @Test
    public void testChatEndpoint() throws Exception {
        mockMvc.perform(post("/webhook/teams")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":[]}"))
                .andExpect(status().isAccepted());

        verify(relayService).relay(eq(ResourceClass.CHAT_MESSAGES), any(ChangeNotificationCollection.class));
    }

    @Test
    public void testMalformedBody() throws Exception {
        mockMvc.perform(post("/webhook/teams")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(relayService);
    }
}
