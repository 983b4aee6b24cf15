package com.example.ConfluenceAgent.tools;

import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class CreateConfluencePageToolDefinition implements AiToolDefinition {

    public static final String NAME = "createConfluencePage";

    public static final String DESCRIPTION = """
            Create a new Confluence page in the space with the given key.
            Content may be HTML (storage format) or plain text; plain text is wrapped in a paragraph.
            Optionally nest the page under a parent page id.
            """;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return DESCRIPTION;
    }

    @Override
    public Set<ToolProfile> profiles() {
        // Writes are only allowed in the full profile
        return Set.of(ToolProfile.FULL);
    }
}
