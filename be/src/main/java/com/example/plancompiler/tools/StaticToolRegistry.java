package com.example.plancompiler.tools;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable {@link ToolRegistry} over a fixed set of definitions. Later duplicates win.
 */
public final class StaticToolRegistry implements ToolRegistry {

    private final Map<String, ToolDefinition> tools;

    private StaticToolRegistry(Map<String, ToolDefinition> tools) {
        this.tools = Map.copyOf(tools);
    }

    public static StaticToolRegistry of(Collection<ToolDefinition> definitions) {
        return new StaticToolRegistry(definitions.stream()
                .collect(Collectors.toMap(ToolDefinition::name, Function.identity(), (first, second) -> second)));
    }

    @Override
    public Optional<ToolDefinition> find(String toolName) {
        return toolName != null ? Optional.ofNullable(tools.get(toolName)) : Optional.empty();
    }

    @Override
    public List<ToolDefinition> getTools() {
        return tools.values().stream()
                .sorted(Comparator.comparing(ToolDefinition::name))
                .toList();
    }
}
