package com.example.ConfluenceAgent.model;

import com.example.ConfluenceAgent.tools.ToolProfile;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-invocation context handed to the agent task, the authentication gate and the tools.
 * Tools reach it through the Spring AI tool context under {@link #CONTEXT_KEY}.
 *
 * The session id scopes chat memory; the principal scopes Atlassian credentials. Temporary
 * sessions all share one principal so a prompt-only caller keeps its credential across calls.
 */
public class InvocationSession {

    public static final String CONTEXT_KEY = "invocationSession";

    public static final String DEFAULT_PRINCIPAL = "default-user";

    private static final String UNKNOWN_TOOL = "Confluence";

    private final String id;
    private final String principal;
    private final boolean temporary;
    private final String model;
    private final ToolProfile toolProfile;
    private final AtomicReference<String> lastToolName = new AtomicReference<>();

    public InvocationSession(String id, boolean temporary, String model, ToolProfile toolProfile) {
        this(id, temporary ? DEFAULT_PRINCIPAL : id, temporary, model, toolProfile);
    }

    public InvocationSession(String id, String principal, boolean temporary, String model, ToolProfile toolProfile) {
        this.id = id;
        this.principal = principal;
        this.temporary = temporary;
        this.model = model;
        this.toolProfile = toolProfile;
    }

    public String id() {
        return id;
    }

    /**
     * Key for credentials and the authorization user id.
     */
    public String principal() {
        return principal;
    }

    public boolean temporary() {
        return temporary;
    }

    public String model() {
        return model;
    }

    public ToolProfile toolProfile() {
        return toolProfile;
    }

    /**
     * Called by a tool as soon as the model invokes it.
     */
    public void recordTool(String toolName) {
        lastToolName.set(toolName);
    }

    /**
     * Last tool invoked in this session, or null if none ran yet.
     */
    public String lastToolName() {
        return lastToolName.get();
    }

    /**
     * Tool name for status messages; never null.
     */
    public String describeTool() {
        String name = lastToolName.get();
        return name == null ? UNKNOWN_TOOL : name;
    }

    @Override
    public String toString() {
        return "InvocationSession[id=" + id + ", principal=" + principal + ", temporary=" + temporary + ", model=" + model + "]";
    }
}
