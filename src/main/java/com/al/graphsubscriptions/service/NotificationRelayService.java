package com.al.graphsubscriptions.service;

import com.al.graphsubscriptions.dto.ChangeNotification;
import com.al.graphsubscriptions.dto.ChangeNotificationCollection;
import com.al.graphsubscriptions.dto.RelayedNotification;
import com.al.graphsubscriptions.model.enums.ResourceClass;
import com.al.graphsubscriptions.service.correlation.ClientStateFactory;
import com.al.graphsubscriptions.service.correlation.NotificationOrigin;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Attributes inbound change notifications to their owner through the correlation tag and publishes them
 * to RabbitMQ. Notifications whose tag does not verify are dropped, and so are notifications the broker
 * refuses; the provider is acknowledged either way.
 */
@Service
@Slf4j
public class NotificationRelayService {

    private final RabbitTemplate rabbitTemplate;
    private final ClientStateFactory clientStateFactory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${app.rabbitmq.notifications-exchange}")
    private String exchange;

    @Value("${app.rabbitmq.notifications-routing-prefix:notification}")
    private String routingPrefix;

    public NotificationRelayService(RabbitTemplate rabbitTemplate, ClientStateFactory clientStateFactory,
            ObjectMapper objectMapper, Clock clock) {
        this.rabbitTemplate = rabbitTemplate;
        this.clientStateFactory = clientStateFactory;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @param endpointClass the resource class the receiving endpoint serves
     * @return number of notifications published
     */
    public int relay(ResourceClass endpointClass, ChangeNotificationCollection batch) {
        if (batch == null || batch.getValue() == null) {
            return 0;
        }
        int relayed = 0;
        for (ChangeNotification notification : batch.getValue()) {
            Optional<NotificationOrigin> origin = clientStateFactory.resolve(notification.getClientState());
            if (origin.isEmpty()) {
                log.warn("Dropping notification for subscription {}: unrecognized clientState",
                        notification.getSubscriptionId());
                continue;
            }
            if (origin.get().getResourceClass() != endpointClass) {
                log.warn("Dropping notification for subscription {}: {} tag delivered to {} endpoint",
                        notification.getSubscriptionId(), origin.get().getResourceClass(), endpointClass);
                continue;
            }
            try {
                publish(origin.get(), notification);
                relayed++;
            } catch (AmqpException e) {
                log.error("Lost notification for subscription {}: broker rejected it: {}",
                        notification.getSubscriptionId(), e.getMessage());
            }
        }
        log.info("Relayed {}/{} {} notification(s)", relayed, batch.getValue().size(), endpointClass);
        return relayed;
    }

    private void publish(NotificationOrigin origin, ChangeNotification notification) {
        RelayedNotification relayed = RelayedNotification.builder()
                .userId(origin.getUserId())
                .teamId(origin.getTeamId())
                .resourceClass(origin.getResourceClass())
                .subscriptionId(notification.getSubscriptionId())
                .changeType(notification.getChangeType())
                .resource(notification.getResource())
                .resourceData(notification.getResourceData())
                .receivedAt(LocalDateTime.now(clock))
                .build();

        String json;
        try {
            json = objectMapper.writeValueAsString(relayed);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize notification " + notification.getSubscriptionId(), e);
        }

        String routingKey = routingPrefix + "." + origin.getResourceClass().getTag();
        rabbitTemplate.convertAndSend(exchange, routingKey, json, message -> {
            message.getMessageProperties().setContentType("application/json");
            message.getMessageProperties().setHeader("userId", origin.getUserId());
            if (origin.getTeamId() != null) {
                message.getMessageProperties().setHeader("teamId", origin.getTeamId());
            }
            return message;
        });
        log.debug("Published notification for subscription {} to {}", notification.getSubscriptionId(), routingKey);
    }
}
