package com.example.ConfluenceAgent.model;

/**
 * A single event pushed to the client while an agent invocation runs.
 *
 * stage   - event kind, also used as the SSE event name:
 *           "status", "error", "authorization_url", "result"
 * message - human-readable description of the step
 * payload - optional payload for the UI, e.g.:
 *           - String for the authorization URL
 *           - AgentResult for the final result
 */
public record StreamEvent(
        String stage,
        String message,
        Object payload
) {
    public static final String STATUS = "status";
    public static final String ERROR = "error";
    public static final String AUTHORIZATION_URL = "authorization_url";
    public static final String RESULT = "result";

    public static StreamEvent status(String message) {
        return new StreamEvent(STATUS, message, null);
    }

    public static StreamEvent error(String message) {
        return new StreamEvent(ERROR, message, null);
    }

    public static StreamEvent authorizationUrl(String url) {
        return new StreamEvent(AUTHORIZATION_URL, "Authorization url: " + url, url);
    }

    public static StreamEvent result(AgentResult result) {
        return new StreamEvent(RESULT, "Agent response.", result);
    }

    public boolean isStage(String candidate) {
        return stage.equals(candidate);
    }
}
