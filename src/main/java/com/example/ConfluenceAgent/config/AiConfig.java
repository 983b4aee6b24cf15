package com.example.ConfluenceAgent.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class AiConfig {

    static final String SYSTEM_PROMPT = """
            You are an agent that works with the user's Atlassian Confluence.
            Based on the user's request you search Confluence pages, show page details
            and create new pages.

            Capabilities:
            - Text search: find pages by keyword
            - Page details: show the content of a specific page
            - Page creation: create a new Confluence page

            When a tool reports that authentication is required, say so plainly.
            When an operation completes, report the result clearly.
            """;

    /**
     * DeepSeek is the default ChatClient.
     * Only created when a DeepSeekChatModel bean exists, so a missing DeepSeek API key
     * does not stop the app from starting.
     */
    @Bean
    @Primary
    @ConditionalOnBean(DeepSeekChatModel.class)
    public ChatClient deepseekChatClient(DeepSeekChatModel model) {
        return confluenceClient(model);
    }

    /**
     * OpenAI ChatClient as an alternative.
     */
    @Bean
    @ConditionalOnBean(OpenAiChatModel.class)
    public ChatClient openaiChatClient(OpenAiChatModel model) {
        return confluenceClient(model);
    }

    /**
     * If no ChatClient beans were registered above, build one from DeepSeek when available,
     * otherwise from OpenAI.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(ChatClient.class)
    public ChatClient defaultChatClient(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        if (deepseekModel != null) {
            return confluenceClient(deepseekModel);
        }

        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            return confluenceClient(openAiModel);
        }

        throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
    }

    private static ChatClient confluenceClient(ChatModel model) {
        return ChatClient.builder(model)
                .defaultSystem(SYSTEM_PROMPT)
                .build();
    }
}
