package com.example.ConfluenceAgent.tools;

import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Central registry for the agent's tools and the profiles they belong to.
 */
@Component
public class ToolRegistry {

    private final Map<String, AiToolDefinition> toolsByName;
    private final Map<ToolProfile, List<AiToolDefinition>> toolsByProfile;

    public ToolRegistry(List<AiToolDefinition> definitions) {
        this.toolsByName = definitions.stream()
                .collect(Collectors.toUnmodifiableMap(
                        AiToolDefinition::name,
                        d -> d
                ));

        Map<ToolProfile, List<AiToolDefinition>> tmp = new EnumMap<>(ToolProfile.class);
        for (AiToolDefinition def : definitions) {
            for (ToolProfile profile : def.profiles()) {
                tmp.computeIfAbsent(profile, p -> new ArrayList<>()).add(def);
            }
        }
        tmp.replaceAll((profile, defs) -> defs.stream()
                .sorted(Comparator.comparing(AiToolDefinition::name))
                .toList());
        this.toolsByProfile = Collections.unmodifiableMap(tmp);
    }

    public List<AiToolDefinition> getToolsForProfile(ToolProfile profile) {
        return toolsByProfile.getOrDefault(profile, List.of());
    }

    /**
     * Function bean names for a profile, passed to ChatClient.toolNames(...)
     */
    public List<String> getFunctionBeanNamesForProfile(ToolProfile profile) {
        return getToolsForProfile(profile).stream()
                .map(AiToolDefinition::functionBeanName)
                .toList();
    }

    public Optional<AiToolDefinition> findByName(String name) {
        return Optional.ofNullable(toolsByName.get(name));
    }

    public Collection<AiToolDefinition> allTools() {
        return toolsByName.values();
    }
}
