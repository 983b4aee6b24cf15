package com.example.ConfluenceAgent.service;

import com.example.ConfluenceAgent.model.AgentResult;
import com.example.ConfluenceAgent.model.InvocationRequest;
import com.example.ConfluenceAgent.model.InvocationSession;
import com.example.ConfluenceAgent.tools.ToolRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link AgentTask} that lets a Spring AI chat model answer the prompt with the
 * Confluence tools of the session's profile.
 */
@Component
@RequiredArgsConstructor
public class ChatClientAgentTask implements AgentTask {

    private static final Logger log = LoggerFactory.getLogger(ChatClientAgentTask.class);

    private final Map<String, ChatClient> chatClients;
    private final ToolRegistry toolRegistry;

    @Override
    public AgentResult invoke(String prompt, InvocationSession session) {
        ChatClient chatClient = resolveClient(session.model());
        List<String> toolNames = toolRegistry.getFunctionBeanNamesForProfile(session.toolProfile());
        log.debug("Invoking model={} for session={} with tools={}", session.model(), session.id(), toolNames);

        String content = chatClient.prompt()
                .user(prompt)
                .toolNames(toolNames.toArray(String[]::new))
                .toolContext(Map.<String, Object>of(InvocationSession.CONTEXT_KEY, session))
                .call()
                .content();

        return AgentResult.assistant(content, session.lastToolName());
    }

    /**
     * Resolve ChatClient bean based on requested model identifier.
     * Supported lookup keys:
     *  - "<model>ChatClient"
     *  - "<model>"
     * Fallback:
     *  - default model "ChatClient"
     *  - any available ChatClient if nothing matches
     */
    private ChatClient resolveClient(String model) {
        String key = Optional.ofNullable(model)
                .map(String::toLowerCase)
                .orElse(InvocationRequest.DEFAULT_MODEL);
        if (chatClients.containsKey(key + "ChatClient")) {
            return chatClients.get(key + "ChatClient");
        }
        if (chatClients.containsKey(key)) {
            return chatClients.get(key);
        }
        ChatClient fallback = chatClients.get(InvocationRequest.DEFAULT_MODEL + "ChatClient");
        if (fallback != null) {
            return fallback;
        }
        return chatClients.values().stream().findFirst()
                .orElseThrow(() -> new IllegalStateException("No ChatClient beans are available"));
    }
}
