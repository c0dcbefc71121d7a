package com.al.graphsubscriptions.service.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Base64;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Reads the granted scopes out of a delegated JWT for diagnostics only. Nothing here influences control flow
 * and a token that cannot be decoded simply yields no description.
 */
@Component
@Slf4j
public class DelegatedTokenInspector {

    private final ObjectMapper objectMapper;

    public DelegatedTokenInspector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void logScopes(AccessToken token) {
        if (!log.isDebugEnabled()) {
            return;
        }
        Optional<String> scopes = describeScopes(token);
        if (scopes.isPresent()) {
            log.debug("Delegated token scopes: {}", scopes.get());
        } else {
            log.debug("Could not decode delegated token scopes");
        }
    }

    /**
     * @return the {@code scp} claim, or the {@code roles} claim joined by spaces
     */
    public Optional<String> describeScopes(AccessToken token) {
        if (token == null || token.getValue() == null) {
            return Optional.empty();
        }
        String[] parts = token.getValue().split("\\.");
        if (parts.length < 2) {
            return Optional.empty();
        }
        try {
            JsonNode claims = objectMapper.readTree(Base64.getUrlDecoder().decode(parts[1]));
            JsonNode scp = claims.path("scp");
            if (scp.isTextual()) {
                return Optional.of(scp.asText());
            }
            JsonNode roles = claims.path("roles");
            if (roles.isArray()) {
                return Optional.of(StreamSupport.stream(roles.spliterator(), false)
                        .map(JsonNode::asText)
                        .collect(Collectors.joining(" ")));
            }
            return Optional.empty();
        } catch (IllegalArgumentException | IOException e) {
            return Optional.empty();
        }
    }
}
