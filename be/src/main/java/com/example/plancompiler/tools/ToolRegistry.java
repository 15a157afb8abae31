package com.example.plancompiler.tools;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookup of tools that workflow plans may call.
 */
public interface ToolRegistry {

    Optional<ToolDefinition> find(String toolName);

    /**
     * All registered tools, sorted by name.
     */
    List<ToolDefinition> getTools();

    default List<String> getAvailableToolNames() {
        return getTools().stream().map(ToolDefinition::name).toList();
    }
}
