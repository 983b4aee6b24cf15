package com.example.ConfluenceAgent.config;

import com.example.ConfluenceAgent.model.InvocationSession;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Settings bound from the {@code confluence-agent.*} prefix:
 *
 * <pre>
 * confluence-agent:
 *   authorization:
 *     provider-name: atlassian_oauth_provider
 *     scopes: read:confluence-content.all write:confluence-content
 *     force-authentication: false
 *     workload-name: confluence-agent
 *     aws-region: us-east-1
 *     default-user-id: default-user
 *     poll-interval: 5s
 *     max-poll-attempts: 60
 *   atlassian:
 *     accessible-resources-url: https://api.atlassian.com/oauth/token/accessible-resources
 *     confluence-api-base: https://api.atlassian.com/ex/confluence
 *   executor:
 *     core-pool-size: 4
 *     authorization-pool-size: 8
 * </pre>
 *
 * Scopes may be separated by commas, whitespace or both.
 */
@ConfigurationProperties(prefix = "confluence-agent")
public record ConfluenceAgentProperties(
        Authorization authorization,
        Atlassian atlassian,
        Executor executor
) {
    public ConfluenceAgentProperties {
        if (authorization == null) {
            authorization = new Authorization(null, null, false, null, null, null, null, 0, null);
        }
        if (atlassian == null) {
            atlassian = new Atlassian(null, null);
        }
        if (executor == null) {
            executor = new Executor(0, 0, 0, 0);
        }
    }

    /**
     * @param providerName        credential provider name in AgentCore Identity
     * @param scopes              Atlassian OAuth scopes
     * @param forceAuthentication request fresh consent on every re-authentication
     * @param workloadName        AgentCore workload identity the agent runs as
     * @param awsRegion           region of the AgentCore Identity data plane
     * @param defaultUserId       user id for requests that carry no session id
     * @param pollInterval        delay between token polls while consent is pending
     * @param maxPollAttempts     polls before the flow gives up
     * @param returnUrl           optional URL the user is sent back to after consent
     */
    public record Authorization(
            String providerName,
            List<String> scopes,
            boolean forceAuthentication,
            String workloadName,
            String awsRegion,
            String defaultUserId,
            Duration pollInterval,
            int maxPollAttempts,
            String returnUrl
    ) {
        public Authorization {
            if (providerName == null || providerName.isBlank()) {
                providerName = "atlassian_oauth_provider";
            }
            scopes = splitScopes(scopes);
            if (workloadName == null || workloadName.isBlank()) {
                workloadName = "confluence-agent";
            }
            if (awsRegion == null || awsRegion.isBlank()) {
                awsRegion = "us-east-1";
            }
            if (defaultUserId == null || defaultUserId.isBlank()) {
                defaultUserId = InvocationSession.DEFAULT_PRINCIPAL;
            }
            if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
                pollInterval = Duration.ofSeconds(5);
            }
            if (maxPollAttempts <= 0) {
                maxPollAttempts = 60;
            }
        }
    }

    private static List<String> splitScopes(List<String> scopes) {
        if (scopes == null) {
            return List.of();
        }
        return scopes.stream()
                .filter(Objects::nonNull)
                .flatMap(scope -> Arrays.stream(scope.trim().split("[\\s,]+")))
                .filter(scope -> !scope.isBlank())
                .toList();
    }

    public record Atlassian(
            String accessibleResourcesUrl,
            String confluenceApiBase
    ) {
        public Atlassian {
            if (accessibleResourcesUrl == null || accessibleResourcesUrl.isBlank()) {
                accessibleResourcesUrl = "https://api.atlassian.com/oauth/token/accessible-resources";
            }
            if (confluenceApiBase == null || confluenceApiBase.isBlank()) {
                confluenceApiBase = "https://api.atlassian.com/ex/confluence";
            }
        }
    }

    public record Executor(
            int corePoolSize,
            int maxPoolSize,
            int queueCapacity,
            int authorizationPoolSize
    ) {
        public Executor {
            if (corePoolSize <= 0) {
                corePoolSize = 4;
            }
            if (maxPoolSize < corePoolSize) {
                maxPoolSize = corePoolSize * 2;
            }
            if (queueCapacity <= 0) {
                queueCapacity = 100;
            }
            if (authorizationPoolSize <= 0) {
                authorizationPoolSize = maxPoolSize;
            }
        }
    }

    /**
     * Defaults only; used by tests and when no configuration is present.
     */
    public static ConfluenceAgentProperties defaults() {
        return new ConfluenceAgentProperties(null, null, null);
    }
}
