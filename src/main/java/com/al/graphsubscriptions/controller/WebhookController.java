package com.al.graphsubscriptions.controller;

import com.al.graphsubscriptions.dto.ChangeNotificationCollection;
import com.al.graphsubscriptions.model.enums.ResourceClass;
import com.al.graphsubscriptions.service.NotificationRelayService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Notification URLs registered with Graph, one per resource class.
 * <p>
 * Graph first calls each URL with a {@code validationToken} query parameter and expects it echoed back as
 * text/plain within a few seconds. Later calls carry a batch of notifications, which must be acknowledged
 * with a 2xx or Graph retries and eventually drops the subscription. The body is bound as a raw string
 * because the validation call is sent as text/plain with no content.
 */
@RestController
@RequestMapping("/webhook")
@Tag(name = "Webhooks")
@Slf4j
public class WebhookController {

    private final NotificationRelayService relayService;
    private final ObjectMapper objectMapper;

    public WebhookController(NotificationRelayService relayService, ObjectMapper objectMapper) {
        this.relayService = relayService;
        this.objectMapper = objectMapper;
    }

    @Operation(summary = "Chat message notifications")
    @PostMapping("/teams")
    public ResponseEntity<String> chatNotifications(
            @RequestParam(value = "validationToken", required = false) String validationToken,
            @RequestBody(required = false) String body) throws JsonProcessingException {
        return handle(ResourceClass.CHAT_MESSAGES, validationToken, body);
    }

    @Operation(summary = "Mail message notifications")
    @PostMapping("/outlook")
    public ResponseEntity<String> mailNotifications(
            @RequestParam(value = "validationToken", required = false) String validationToken,
            @RequestBody(required = false) String body) throws JsonProcessingException {
        return handle(ResourceClass.MAIL_MESSAGES, validationToken, body);
    }

    @Operation(summary = "Team channel message notifications")
    @PostMapping("/teams-channels")
    public ResponseEntity<String> channelNotifications(
            @RequestParam(value = "validationToken", required = false) String validationToken,
            @RequestBody(required = false) String body) throws JsonProcessingException {
        return handle(ResourceClass.CHANNEL_MESSAGES, validationToken, body);
    }

    private ResponseEntity<String> handle(ResourceClass resourceClass, String validationToken, String body)
            throws JsonProcessingException {
        if (validationToken != null) {
            log.info("Answering {} subscription validation handshake", resourceClass);
            return ResponseEntity.ok()
                    .contentType(MediaType.TEXT_PLAIN)
                    .body(validationToken);
        }
        if (body == null || body.isBlank()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).build();
        }
        ChangeNotificationCollection batch = objectMapper.readValue(body, ChangeNotificationCollection.class);
        relayService.relay(resourceClass, batch);
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }
}
