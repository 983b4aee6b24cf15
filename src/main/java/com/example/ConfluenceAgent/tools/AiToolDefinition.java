package com.example.ConfluenceAgent.tools;

import java.util.Set;

/**
 * Metadata for a tool the agent may call.
 * The tool logic lives in a separate function bean registered under {@link #functionBeanName()}.
 */
public interface AiToolDefinition {
    /**
     * Unique tool name, used as the function bean name and in ChatClient.toolNames(...)
     */
    String name();

    /**
     * Natural language description visible to the LLM.
     */
    String description();

    /**
     * Tool profiles in which this tool is enabled.
     */
    Set<ToolProfile> profiles();

    default String functionBeanName() {
        return name();
    }
}
