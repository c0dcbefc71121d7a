package com.al.graphsubscriptions.controller;

import com.al.graphsubscriptions.dto.ProvisionResult;
import com.al.graphsubscriptions.exception.MissingCredentialException;
import com.al.graphsubscriptions.service.SubscriptionProvisioner;
import com.al.graphsubscriptions.service.auth.AccessToken;
import com.al.graphsubscriptions.service.auth.TokenProvider;
import com.al.graphsubscriptions.service.auth.UserSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
@Tag(name = "Provisioning")
@Slf4j
public class ProvisioningController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SubscriptionProvisioner provisioner;
    private final TokenProvider tokenProvider;

    /**
     * Creates chat, mail and team-channel subscriptions for the signed-in user. The caller passes the Graph
     * token it holds for that user.
     */
    @Operation(summary = "Provision all subscriptions for a user", security = @SecurityRequirement(name = "bearerAuth"))
    @PostMapping("/{userId}/subscriptions")
    public ResponseEntity<ProvisionResult> provision(@PathVariable String userId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            throw new MissingCredentialException("A Bearer token for Microsoft Graph is required");
        }
        UserSession session = new UserSession(userId, authorization.substring(BEARER_PREFIX.length()).trim());
        AccessToken delegated = tokenProvider.getDelegatedToken(session);

        ProvisionResult result = provisioner.provision(userId, delegated);
        log.info("Provisioned user {}: {} created, {} failed", userId, result.getCreatedCount(),
                result.getFailedCount());
        return ResponseEntity.ok(result);
    }
}
