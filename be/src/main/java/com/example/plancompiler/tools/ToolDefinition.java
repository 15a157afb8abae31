package com.example.plancompiler.tools;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A tool a plan may call: its name, the state machine resource that executes it,
 * and its declared parameters.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolDefinition(String name, String description, String resource, List<ToolParameter> parameters) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name");
        description = description != null ? description : "";
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    public Set<String> parameterNames() {
        return parameters.stream()
                .map(ToolParameter::name)
                .collect(Collectors.toUnmodifiableSet());
    }
}
