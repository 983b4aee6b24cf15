package com.example.ConfluenceAgent.auth;

/**
 * OAuth2 flow requested from AgentCore Identity.
 */
public enum AuthFlowType {
    /** Three-legged flow on behalf of the end user; may need interactive consent. */
    USER_FEDERATION,
    /** Client credentials flow; never needs consent. */
    M2M
}
