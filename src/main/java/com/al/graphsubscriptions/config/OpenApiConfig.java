package com.al.graphsubscriptions.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Swagger UI at /swagger-ui.html, OpenAPI JSON at /v3/api-docs.
 */
@Configuration
public class OpenApiConfig {

        @Value("${spring.application.name:graph-subscription-manager}")
        private String applicationName;

        @Bean
        public OpenAPI customOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title(applicationName + " API")
                                                .version("1.0.0")
                                                .description("""
                                                                Keeps Microsoft Graph change-notification subscriptions alive for signed-in users.

                                                                ## Features
                                                                - **Provisioning**: chat, mail and team-channel subscriptions in one call
                                                                - **Renewal**: scheduled and on-demand passes over expiring subscriptions
                                                                - **Webhooks**: validation handshake and relay of verified notifications to RabbitMQ

                                                                ## Authentication
                                                                Provisioning takes the user's Graph token as a Bearer header. The cron endpoint takes the
                                                                shared cron secret. Administrative endpoints use Basic Authentication.
                                                                """))
                                .tags(List.of(
                                                new Tag().name("Provisioning")
                                                                .description("Subscription creation for a signed-in user"),
                                                new Tag().name("Renewal")
                                                                .description("On-demand renewal pass"),
                                                new Tag().name("Administration")
                                                                .description("Inspection and retirement of stored subscriptions"),
                                                new Tag().name("Webhooks")
                                                                .description("Notification endpoints called by Graph")))
                                .components(new Components()
                                                .addSecuritySchemes("basicAuth", new SecurityScheme()
                                                                .type(SecurityScheme.Type.HTTP)
                                                                .scheme("basic"))
                                                .addSecuritySchemes("bearerAuth", new SecurityScheme()
                                                                .type(SecurityScheme.Type.HTTP)
                                                                .scheme("bearer")));
        }
}
