package com.al.graphsubscriptions.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Clock;

@Configuration
public class HttpClientConfig {

    /**
     * Shared client for Graph and the token endpoint. The JDK client supports PATCH (used for renewal),
     * and the read timeout bounds every call.
     */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, GraphProperties graphProperties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(graphProperties.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(graphProperties.getReadTimeout());
        return builder.requestFactory(() -> requestFactory).build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
