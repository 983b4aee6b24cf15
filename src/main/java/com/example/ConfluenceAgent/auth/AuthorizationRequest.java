package com.example.ConfluenceAgent.auth;

import java.util.List;

/**
 * Parameters of one access-token request to the external authorization provider.
 *
 * @param providerName        credential provider registered with AgentCore Identity
 * @param scopes              OAuth scopes to request
 * @param flowType            OAuth2 flow
 * @param forceAuthentication ask for fresh consent even if AgentCore holds a token
 * @param userId              principal the token is requested for
 */
public record AuthorizationRequest(
        String providerName,
        List<String> scopes,
        AuthFlowType flowType,
        boolean forceAuthentication,
        String userId
) {
    public AuthorizationRequest {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }
}
