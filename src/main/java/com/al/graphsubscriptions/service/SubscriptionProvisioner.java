package com.al.graphsubscriptions.service;

import com.al.graphsubscriptions.config.SubscriptionProperties;
import com.al.graphsubscriptions.dto.ProvisionOutcome;
import com.al.graphsubscriptions.dto.ProvisionResult;
import com.al.graphsubscriptions.exception.GraphApiException;
import com.al.graphsubscriptions.exception.PrincipalMismatchException;
import com.al.graphsubscriptions.exception.RegistryException;
import com.al.graphsubscriptions.model.Subscription;
import com.al.graphsubscriptions.model.enums.ChangeType;
import com.al.graphsubscriptions.model.enums.FailureKind;
import com.al.graphsubscriptions.model.enums.ProvisionStatus;
import com.al.graphsubscriptions.model.enums.ResourceClass;
import com.al.graphsubscriptions.model.enums.TeamEnumerationStatus;
import com.al.graphsubscriptions.service.auth.AccessToken;
import com.al.graphsubscriptions.service.auth.DelegatedTokenInspector;
import com.al.graphsubscriptions.service.auth.TokenProvider;
import com.al.graphsubscriptions.service.correlation.ClientStateFactory;
import com.al.graphsubscriptions.service.correlation.NotificationOrigin;
import com.al.graphsubscriptions.service.graph.GraphDirectoryClient;
import com.al.graphsubscriptions.service.graph.GraphSubscriptionClient;
import com.al.graphsubscriptions.service.graph.GraphTeam;
import com.al.graphsubscriptions.service.graph.GraphUser;
import com.al.graphsubscriptions.service.graph.RemoteSubscription;
import com.al.graphsubscriptions.service.graph.SubscriptionSpec;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Creates the chat, mail and team-channel subscriptions for one user.
 *
 * <p>
 * Only resolving the user's identity (and obtaining the application credential used for the create
 * calls) can fail the whole call. Every creation attempt is isolated and reported as its own
 * {@link ProvisionOutcome}; team-channel attempts run on a small bounded executor.
 */
@Service
@Slf4j
public class SubscriptionProvisioner {

    private final GraphDirectoryClient directoryClient;
    private final GraphSubscriptionClient subscriptionClient;
    private final TokenProvider tokenProvider;
    private final SubscriptionRegistry registry;
    private final ClientStateFactory clientStateFactory;
    private final DelegatedTokenInspector tokenInspector;
    private final SubscriptionProperties properties;
    private final Executor teamExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public SubscriptionProvisioner(GraphDirectoryClient directoryClient,
            GraphSubscriptionClient subscriptionClient,
            TokenProvider tokenProvider,
            SubscriptionRegistry registry,
            ClientStateFactory clientStateFactory,
            DelegatedTokenInspector tokenInspector,
            SubscriptionProperties properties,
            @Qualifier("teamProvisioningExecutor") Executor teamExecutor,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.directoryClient = directoryClient;
        this.subscriptionClient = subscriptionClient;
        this.tokenProvider = tokenProvider;
        this.registry = registry;
        this.clientStateFactory = clientStateFactory;
        this.tokenInspector = tokenInspector;
        this.properties = properties;
        this.teamExecutor = teamExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * @param userId the signed-in user's Graph object id or user principal name; it must identify the owner of
     *        {@code delegated}
     * @throws IllegalArgumentException if {@code userId} cannot be carried in a correlation tag
     * @throws PrincipalMismatchException if {@code delegated} was issued to a different user
     * @throws GraphApiException if the signed-in user cannot be resolved
     * @throws com.al.graphsubscriptions.exception.TokenAcquisitionException if no application credential
     *         can be obtained
     */
    public ProvisionResult provision(String userId, AccessToken delegated) {
        if (!clientStateFactory.supportsUserId(userId)) {
            throw new IllegalArgumentException("userId is empty or too long for a correlation tag");
        }
        GraphUser principal;
        try {
            principal = directoryClient.getMe(delegated);
        } catch (GraphApiException e) {
            log.error("Cannot resolve principal for user {}: {}", userId, e.getMessage());
            throw e;
        }
        if (!isSamePrincipal(userId, principal)) {
            log.warn("Refusing to provision user {} with a credential issued to {}", userId, principal.getId());
            throw new PrincipalMismatchException("The Graph token was not issued to user " + userId);
        }
        String upn = principal.getUserPrincipalName();
        log.info("Creating subscriptions for user {} ({})", userId, upn);

        ProvisioningContext context = new ProvisioningContext(userId, upn,
                tokenProvider.getApplicationToken(), properties.normalizedNotificationBaseUrl());

        ProvisionResult result = ProvisionResult.builder()
                .userId(userId)
                .userPrincipalName(upn)
                .build();

        result.getOutcomes().add(createSubscription(context, ResourceClass.CHAT_MESSAGES, null));
        result.getOutcomes().add(createSubscription(context, ResourceClass.MAIL_MESSAGES, null));

        tokenInspector.logScopes(delegated);

        List<GraphTeam> teams;
        try {
            teams = directoryClient.listJoinedTeams(delegated);
            result.setTeamEnumeration(TeamEnumerationStatus.ENUMERATED);
            log.info("Found {} team(s) for user {}", teams.size(), userId);
        } catch (GraphApiException e) {
            teams = Collections.emptyList();
            if (e.isAuthorizationFailure()) {
                log.warn("User {} cannot list joined teams (likely a guest or missing consent). "
                        + "Skipping channel subscriptions.", userId);
                result.setTeamEnumeration(TeamEnumerationStatus.SKIPPED_UNAUTHORIZED);
            } else {
                log.error("Failed to list joined teams for user {}: {}", userId, e.getMessage());
                result.setTeamEnumeration(TeamEnumerationStatus.FAILED);
            }
            result.setTeamEnumerationReason(e.getMessage());
        }

        result.getOutcomes().addAll(createTeamSubscriptions(context, teams));

        log.info("Provisioning for user {} finished: {} created, {} failed", userId,
                result.getCreatedCount(), result.getFailedCount());
        return result;
    }

    private List<ProvisionOutcome> createTeamSubscriptions(ProvisioningContext context, List<GraphTeam> teams) {
        List<CompletableFuture<ProvisionOutcome>> futures = new ArrayList<>();
        for (GraphTeam team : teams) {
            CompletableFuture<ProvisionOutcome> future;
            try {
                future = CompletableFuture.supplyAsync(
                        () -> createSubscription(context, ResourceClass.CHANNEL_MESSAGES, team), teamExecutor);
            } catch (RejectedExecutionException e) {
                future = CompletableFuture.completedFuture(
                        failed(ResourceClass.CHANNEL_MESSAGES, team, FailureKind.UNEXPECTED, e.getMessage()));
            }
            futures.add(future);
        }

        return futures.stream()
                .map(this::await)
                .collect(Collectors.toList());
    }

    private ProvisionOutcome await(CompletableFuture<ProvisionOutcome> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            // createSubscription never throws; reaching here means the task itself could not run
            return failed(ResourceClass.CHANNEL_MESSAGES, null, FailureKind.UNEXPECTED, e.getMessage());
        }
    }

    private ProvisionOutcome createSubscription(ProvisioningContext context, ResourceClass resourceClass,
            GraphTeam team) {
        String teamId = team != null ? team.getId() : null;
        try {
            String resource = team != null
                    ? ResourceClass.resourceForTeam(teamId)
                    : resourceClass.resourceForUser(context.userPrincipalName);
            String clientState = clientStateFactory.issue(
                    new NotificationOrigin(resourceClass, context.userId, teamId));
            Instant requested = clock.instant().plus(properties.validityFor(resourceClass));

            SubscriptionSpec spec = SubscriptionSpec.builder()
                    .resource(resource)
                    .notificationUrl(context.notificationBaseUrl + resourceClass.getNotificationPath())
                    .changeTypes(ChangeType.parse(properties.getChangeTypes()))
                    .expiration(requested)
                    .clientState(clientState)
                    .build();

            RemoteSubscription remote;
            try {
                remote = subscriptionClient.create(spec, context.applicationToken);
            } catch (GraphApiException e) {
                log.warn("{} subscription failed for user {}{}: {}", resourceClass, context.userId,
                        describeTeam(team), e.getMessage());
                return failed(resourceClass, team, e.getFailureKind(), e.getMessage());
            }

            Instant granted = remote.getExpirationDateTime() != null ? remote.getExpirationDateTime() : requested;
            Subscription record = Subscription.builder()
                    .subscriptionId(remote.getId())
                    .userId(context.userId)
                    .teamId(teamId)
                    .teamName(team != null ? team.getDisplayName() : null)
                    .resource(resource)
                    .changeType(spec.getChangeTypes())
                    .clientState(clientState)
                    .expirationDateTime(granted)
                    .createdAt(clock.instant())
                    .build();

            try {
                registry.insert(record);
            } catch (RegistryException e) {
                compensate(remote.getId(), context.applicationToken);
                return failed(resourceClass, team, FailureKind.REGISTRY, e.getMessage());
            }

            log.info("{} subscription {} created for user {}{}, expires {}", resourceClass, remote.getId(),
                    context.userId, describeTeam(team), granted);
            count(resourceClass, ProvisionStatus.CREATED);
            return ProvisionOutcome.builder()
                    .resourceClass(resourceClass)
                    .teamId(teamId)
                    .teamName(team != null ? team.getDisplayName() : null)
                    .status(ProvisionStatus.CREATED)
                    .subscriptionId(remote.getId())
                    .expirationDateTime(granted)
                    .build();
        } catch (RuntimeException e) {
            log.error("Unexpected error creating {} subscription for user {}{}", resourceClass, context.userId,
                    describeTeam(team), e);
            return failed(resourceClass, team, FailureKind.UNEXPECTED, e.getMessage());
        }
    }

    /**
     * The remote subscription exists but could not be recorded. Remove it so no unrenewable subscription
     * is left behind.
     */
    private void compensate(String subscriptionId, AccessToken applicationToken) {
        try {
            subscriptionClient.delete(subscriptionId, applicationToken);
            log.warn("Deleted remote subscription {} after registry write failed", subscriptionId);
        } catch (GraphApiException e) {
            log.error("Remote subscription {} is orphaned: registry write and compensating delete both failed: {}",
                    subscriptionId, e.getMessage());
        }
    }

    private ProvisionOutcome failed(ResourceClass resourceClass, GraphTeam team, FailureKind kind, String reason) {
        count(resourceClass, ProvisionStatus.FAILED);
        return ProvisionOutcome.builder()
                .resourceClass(resourceClass)
                .teamId(team != null ? team.getId() : null)
                .teamName(team != null ? team.getDisplayName() : null)
                .status(ProvisionStatus.FAILED)
                .failureKind(kind)
                .reason(reason)
                .build();
    }

    private void count(ResourceClass resourceClass, ProvisionStatus status) {
        meterRegistry.counter("graph.subscriptions.provision",
                "resourceClass", resourceClass.name(), "status", status.name()).increment();
    }

    private static boolean isSamePrincipal(String userId, GraphUser principal) {
        return userId.equals(principal.getId()) || userId.equalsIgnoreCase(principal.getUserPrincipalName());
    }

    private static String describeTeam(GraphTeam team) {
        return team == null ? "" : " in team " + team.getDisplayName() + " (" + team.getId() + ")";
    }

    private static final class ProvisioningContext {
        private final String userId;
        private final String userPrincipalName;
        private final AccessToken applicationToken;
        private final String notificationBaseUrl;

        private ProvisioningContext(String userId, String userPrincipalName, AccessToken applicationToken,
                String notificationBaseUrl) {
            this.userId = userId;
            this.userPrincipalName = userPrincipalName;
            this.applicationToken = applicationToken;
            this.notificationBaseUrl = notificationBaseUrl;
        }
    }
}
