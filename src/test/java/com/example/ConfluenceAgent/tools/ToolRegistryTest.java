package com.example.ConfluenceAgent.tools;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ToolRegistryTest {

    private final ToolRegistry registry = new ToolRegistry(List.of(
            new SearchConfluenceToolDefinition(),
            new GetConfluencePageToolDefinition(),
            new CreateConfluencePageToolDefinition()
    ));

    @Test
    void fullProfileExposesAllToolsSortedByName() {
        assertThat(registry.getFunctionBeanNamesForProfile(ToolProfile.FULL))
                .containsExactly("createConfluencePage", "getConfluencePage", "searchConfluenceByText");
    }

    @Test
    void readOnlyProfileCannotCreatePages() {
        assertThat(registry.getFunctionBeanNamesForProfile(ToolProfile.READ_ONLY))
                .containsExactly("getConfluencePage", "searchConfluenceByText");
    }

    @Test
    void lookupByName() {
        assertThat(registry.findByName("createConfluencePage")).isPresent();
        assertThat(registry.findByName("deletePage")).isEmpty();
        assertThat(registry.allTools()).hasSize(3);
    }
}
