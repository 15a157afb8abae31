package com.example.plancompiler.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Invocation of a registered tool.
 * <p>
 * Parameter values are literals, nested maps, or {@code {% ... %}} templates referencing
 * variables in scope. {@code outputVariable} and {@code errorHandler} are optional.
 * </p>
 */
public record ToolCallNode(
        String description,
        String toolName,
        Map<String, Object> parameters,
        String outputVariable,
        WorkflowNode errorHandler
) implements WorkflowNode {

    public static final String TYPE = "tool_call";

    public ToolCallNode {
        Objects.requireNonNull(toolName, "toolName");
        // LinkedHashMap keeps null values and argument order
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
