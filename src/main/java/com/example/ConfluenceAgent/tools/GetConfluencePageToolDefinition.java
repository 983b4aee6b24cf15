package com.example.ConfluenceAgent.tools;

import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class GetConfluencePageToolDefinition implements AiToolDefinition {

    public static final String NAME = "getConfluencePage";

    public static final String DESCRIPTION = """
            Get the details and storage-format content of the Confluence page with the given id.
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
        return Set.of(ToolProfile.READ_ONLY, ToolProfile.FULL);
    }
}
