package com.example.ConfluenceAgent.model;

import com.example.ConfluenceAgent.tools.ToolProfile;

import java.util.Set;
import java.util.UUID;

/**
 * Request payload for one agent invocation.
 *
 * @param prompt       user prompt
 * @param sessionId    optional session id for memory and credential separation
 * @param model        optional model name hint ("deepseek", "openai")
 * @param toolProfile  optional tool profile ("READ_ONLY", "FULL")
 */
public record InvocationRequest(
        String prompt,
        String sessionId,
        String model,
        String toolProfile
) {
    private static final Set<String> models = Set.of("deepseek", "openai");
    public static final String DEFAULT_MODEL = "deepseek";
    public static final String MISSING_PROMPT = "No prompt found in input";

    public String resolvePrompt() {
        return prompt == null || prompt.isBlank() ? MISSING_PROMPT : prompt;
    }

    public String resolveModel() {
        return (model == null || model.isBlank()
                || !models.contains(model.toLowerCase())) ? DEFAULT_MODEL : model.toLowerCase();
    }

    /**
     * Resolve the tool profile for this request.
     * Null, blank or unknown values fall back to defaultProfile.
     */
    public ToolProfile resolveToolProfile(ToolProfile defaultProfile) {
        if (toolProfile == null || toolProfile.isBlank()) {
            return defaultProfile;
        }
        try {
            String normalized = toolProfile
                    .trim()
                    .replace(' ', '_')
                    .replace('-', '_')
                    .toUpperCase();
            return ToolProfile.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            return defaultProfile;
        }
    }

    public InvocationSession resolveSession(ToolProfile defaultProfile) {
        return resolveSession(defaultProfile, InvocationSession.DEFAULT_PRINCIPAL);
    }

    /**
     * Requests without a session id get a fresh temporary session bound to defaultPrincipal.
     */
    public InvocationSession resolveSession(ToolProfile defaultProfile, String defaultPrincipal) {
        boolean temporary = sessionId == null || sessionId.isBlank();
        String resolvedId = temporary ? "temp-" + UUID.randomUUID() : sessionId;
        String principal = temporary ? defaultPrincipal : sessionId;
        return new InvocationSession(resolvedId, principal, temporary, resolveModel(), resolveToolProfile(defaultProfile));
    }
}
