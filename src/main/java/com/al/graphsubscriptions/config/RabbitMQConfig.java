package com.al.graphsubscriptions.config;

import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Topology for relayed change notifications: one topic exchange, routing keys
 * {@code <prefix>.chat|mail|channel}, and a default queue receiving all of them with a dead-letter queue.
 */
@Configuration
public class RabbitMQConfig {

    @Value("${app.rabbitmq.notifications-exchange}")
    private String exchangeName;

    @Value("${app.rabbitmq.notifications-routing-prefix:notification}")
    private String routingPrefix;

    @Value("${app.rabbitmq.notifications-queue}")
    private String queueName;

    @Value("${app.rabbitmq.dlx}")
    private String dlxName;

    @Value("${app.rabbitmq.dlq}")
    private String dlqName;

    @Bean
    Exchange notificationsExchange() {
        return ExchangeBuilder.topicExchange(exchangeName).durable(true).build();
    }

    @Bean
    Queue notificationsQueue() {
        return QueueBuilder.durable(queueName)
                .withArgument("x-dead-letter-exchange", dlxName)
                .withArgument("x-dead-letter-routing-key", queueName)
                .build();
    }

    @Bean
    Binding notificationsBinding() {
        return BindingBuilder.bind(notificationsQueue())
                .to(notificationsExchange())
                .with(routingPrefix + ".#")
                .noargs();
    }

    @Bean
    Exchange deadLetterExchange() {
        return ExchangeBuilder.directExchange(dlxName).durable(true).build();
    }

    @Bean
    Queue deadLetterQueue() {
        return QueueBuilder.durable(dlqName).build();
    }

    @Bean
    Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue())
                .to(deadLetterExchange())
                .with(queueName)
                .noargs();
    }
}
