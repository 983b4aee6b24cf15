package com.example.ConfluenceAgent.auth;

import com.example.ConfluenceAgent.config.ConfluenceAgentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.bedrockagentcore.BedrockAgentCoreClient;
import software.amazon.awssdk.services.bedrockagentcore.model.GetResourceOauth2TokenRequest;
import software.amazon.awssdk.services.bedrockagentcore.model.GetResourceOauth2TokenResponse;
import software.amazon.awssdk.services.bedrockagentcore.model.GetWorkloadAccessTokenForUserIdRequest;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * {@link AuthorizationFlow} backed by Amazon Bedrock AgentCore Identity.
 *
 * Flow:
 *  1. exchange the user id for a workload access token of the configured workload
 *  2. ask the credential provider for an OAuth2 token on behalf of that workload token
 *  3. if AgentCore answers with an authorization URL instead, hand it to the callback and
 *     poll until the user has consented or the poll budget runs out
 */
@Component
public class AgentCoreAuthorizationFlow implements AuthorizationFlow {

    private static final Logger log = LoggerFactory.getLogger(AgentCoreAuthorizationFlow.class);

    private final BedrockAgentCoreClient agentCoreClient;
    private final ConfluenceAgentProperties.Authorization settings;
    private final Executor executor;

    public AgentCoreAuthorizationFlow(BedrockAgentCoreClient agentCoreClient,
                                      ConfluenceAgentProperties properties,
                                      @Qualifier("authorizationExecutor") Executor executor) {
        this.agentCoreClient = agentCoreClient;
        this.settings = properties.authorization();
        this.executor = executor;
    }

    @Override
    public CompletableFuture<String> requestAccessToken(AuthorizationRequest request,
                                                        Consumer<String> onAuthorizationUrl) {
        return CompletableFuture.supplyAsync(() -> obtainToken(request, onAuthorizationUrl), executor);
    }

    private String obtainToken(AuthorizationRequest request, Consumer<String> onAuthorizationUrl) {
        String workloadToken = workloadAccessToken(request.userId());

        GetResourceOauth2TokenResponse response = fetch(workloadToken, request, request.forceAuthentication());
        if (hasText(response.accessToken())) {
            log.info("AgentCore Identity returned an access token for provider={}", request.providerName());
            return response.accessToken();
        }
        if (!hasText(response.authorizationUrl())) {
            throw new AuthorizationException("AgentCore Identity returned neither an access token nor an authorization URL");
        }

        logAuthorizationUrl(response.authorizationUrl());
        onAuthorizationUrl.accept(response.authorizationUrl());

        Duration interval = settings.pollInterval();
        for (int attempt = 1; attempt <= settings.maxPollAttempts(); attempt++) {
            sleep(interval);
            // Consent is already in flight; forcing again would issue a new URL
            GetResourceOauth2TokenResponse polled = fetch(workloadToken, request, false);
            if (hasText(polled.accessToken())) {
                log.info("User consent completed after {} poll(s)", attempt);
                return polled.accessToken();
            }
            log.debug("Waiting for user consent (poll {}/{})", attempt, settings.maxPollAttempts());
        }
        throw new AuthorizationException("Timed out waiting for user consent after "
                + settings.maxPollAttempts() + " polls");
    }

    private String workloadAccessToken(String userId) {
        GetWorkloadAccessTokenForUserIdRequest tokenRequest = GetWorkloadAccessTokenForUserIdRequest.builder()
                .workloadName(settings.workloadName())
                .userId(userId)
                .build();
        String token;
        try {
            token = agentCoreClient.getWorkloadAccessTokenForUserId(tokenRequest).workloadAccessToken();
        } catch (SdkException e) {
            throw new AuthorizationException("Workload access token request failed: " + e.getMessage(), e);
        }
        if (!hasText(token)) {
            throw new AuthorizationException("AgentCore Identity returned an empty workload access token");
        }
        return token;
    }

    private GetResourceOauth2TokenResponse fetch(String workloadToken,
                                                 AuthorizationRequest request,
                                                 boolean forceAuthentication) {
        GetResourceOauth2TokenRequest.Builder builder = GetResourceOauth2TokenRequest.builder()
                .workloadIdentityToken(workloadToken)
                .resourceCredentialProviderName(request.providerName())
                .scopes(request.scopes())
                .oauth2Flow(request.flowType().name())
                .forceAuthentication(forceAuthentication);
        if (hasText(settings.returnUrl())) {
            builder.resourceOauth2ReturnUrl(settings.returnUrl());
        }

        try {
            return agentCoreClient.getResourceOauth2Token(builder.build());
        } catch (SdkException e) {
            throw new AuthorizationException("Resource OAuth2 token request failed: " + e.getMessage(), e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static void sleep(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthorizationException("Interrupted while waiting for user consent", e);
        }
    }

    private static void logAuthorizationUrl(String url) {
        String separator = "=".repeat(80);
        log.info("\n{}\nAUTHORIZATION REQUIRED\n{}\nPlease open this URL in your browser:\n{}\n{}",
                separator, separator, url, separator);
    }
}
