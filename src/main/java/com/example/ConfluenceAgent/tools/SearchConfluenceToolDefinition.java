package com.example.ConfluenceAgent.tools;

import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class SearchConfluenceToolDefinition implements AiToolDefinition {

    public static final String NAME = "searchConfluenceByText";

    public static final String DESCRIPTION = """
            Search Confluence pages whose title or body contains the given text.
            Returns page ids, titles, space names, excerpts and links.
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
