package com.example.ConfluenceAgent.model;

/**
 * Structured result of one agent task invocation.
 *
 * @param role      message role reported by the model, usually "assistant"
 * @param content   text content, used for auth-need classification
 * @param toolName  last Confluence tool the model called, or null
 */
public record AgentResult(
        String role,
        String content,
        String toolName
) {
    public static AgentResult assistant(String content, String toolName) {
        return new AgentResult("assistant", content == null ? "" : content, toolName);
    }
}
