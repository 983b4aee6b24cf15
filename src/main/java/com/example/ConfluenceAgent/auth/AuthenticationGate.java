package com.example.ConfluenceAgent.auth;

import com.example.ConfluenceAgent.client.AccessibleResource;
import com.example.ConfluenceAgent.client.AtlassianResourceClient;
import com.example.ConfluenceAgent.config.ConfluenceAgentProperties;
import com.example.ConfluenceAgent.model.InvocationSession;
import com.example.ConfluenceAgent.model.StreamEvent;
import com.example.ConfluenceAgent.stream.StreamingChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Obtains a fresh Atlassian credential for a session and reports progress on the
 * invocation's stream.
 *
 * Flow:
 *  1. announce re-authentication
 *  2. request a token from the external authorization flow; if consent is needed the
 *     authorization URL is published as its own stream event
 *  3. resolve the cloud id for the token
 *  4. store the credential and report success, or report failure and store nothing
 */
@Component
public class AuthenticationGate {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationGate.class);

    private final AuthorizationFlow authorizationFlow;
    private final AtlassianResourceClient resourceClient;
    private final CredentialRegistry credentialRegistry;
    private final TokenMetadataDecoder tokenMetadataDecoder;
    private final ConfluenceAgentProperties.Authorization settings;

    public AuthenticationGate(AuthorizationFlow authorizationFlow,
                              AtlassianResourceClient resourceClient,
                              CredentialRegistry credentialRegistry,
                              TokenMetadataDecoder tokenMetadataDecoder,
                              ConfluenceAgentProperties properties) {
        this.authorizationFlow = authorizationFlow;
        this.resourceClient = resourceClient;
        this.credentialRegistry = credentialRegistry;
        this.tokenMetadataDecoder = tokenMetadataDecoder;
        this.settings = properties.authorization();
    }

    /**
     * @return true if a credential was stored for the session
     */
    public boolean handleAuthentication(InvocationSession session, StreamingChannel channel) {
        String toolName = session.describeTool();
        channel.put(StreamEvent.status(
                "Authentication required for " + toolName + " access. Starting authorization flow..."));

        return credentialRegistry.withAuthenticationLock(session.principal(), () -> authenticate(session, channel, toolName));
    }

    private boolean authenticate(InvocationSession session, StreamingChannel channel, String toolName) {
        try {
            String accessToken = awaitToken(session, channel);
            Optional<AccessibleResource> resource = resourceClient.findPrimaryResource(accessToken);
            if (resource.isEmpty()) {
                log.warn("Authentication for session={} produced a token but no Atlassian cloud id", session.id());
                channel.put(StreamEvent.error("Failed to obtain Atlassian Cloud ID"));
                return false;
            }

            AtlassianCredential credential = new AtlassianCredential(
                    accessToken,
                    resource.get().id(),
                    resource.get().url(),
                    tokenMetadataDecoder.decode(accessToken)
            );
            credentialRegistry.store(session.principal(), credential);

            channel.put(StreamEvent.status("Authentication successful! Atlassian Cloud ID: " + credential.cloudId()));
            channel.put(StreamEvent.status("Retrying " + toolName + "..."));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.put(StreamEvent.error("Authentication failed: interrupted while waiting for authorization"));
            return false;
        } catch (Exception e) {
            log.warn("Authentication failed for session={}: {}", session.id(), describe(e), e);
            channel.put(StreamEvent.error("Authentication failed: " + describe(e)));
            return false;
        }
    }

    private String awaitToken(InvocationSession session, StreamingChannel channel) throws InterruptedException {
        AuthorizationRequest request = new AuthorizationRequest(
                settings.providerName(),
                settings.scopes(),
                AuthFlowType.USER_FEDERATION,
                settings.forceAuthentication(),
                session.principal()
        );
        try {
            return authorizationFlow.requestAccessToken(request, authorizationUrlCallback(channel)).get();
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new AuthorizationException(describe(cause), cause);
        }
    }

    static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    /**
     * Publishes the consent URL on the stream and returns at once;
     * the external flow resumes on its own.
     */
    static Consumer<String> authorizationUrlCallback(StreamingChannel channel) {
        return url -> {
            log.info("Authorization required, consent URL sent to client: {}", url);
            channel.put(StreamEvent.authorizationUrl(url));
        };
    }
}
