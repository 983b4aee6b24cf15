package com.example.ConfluenceAgent.auth;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * External provider that mints Atlassian access tokens.
 */
public interface AuthorizationFlow {

    /**
     * Request an access token.
     *
     * @param request           scopes, flow type and re-authentication flag
     * @param onAuthorizationUrl invoked only when the user has to grant consent out-of-band;
     *                          must return immediately
     * @return future completed with the bearer token, or exceptionally with an
     *         {@link AuthorizationException}
     */
    CompletableFuture<String> requestAccessToken(AuthorizationRequest request, Consumer<String> onAuthorizationUrl);
}
