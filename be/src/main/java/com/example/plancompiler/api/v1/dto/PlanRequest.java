package com.example.plancompiler.api.v1.dto;

import com.example.plancompiler.tools.ToolDefinition;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request body for validating or compiling a plan.
 * <p>
 * {@code plan} is the plan document, either as a JSON object or as a JSON-encoded string.
 * {@code tools}, when present, replaces the default tool catalog for this request.
 * {@code inputs} names the variables the caller supplies when the program starts.
 * </p>
 */
public record PlanRequest(
        @NotNull Object plan,
        @Valid List<ToolDefinition> tools,
        List<String> inputs
) {

    public List<String> inputsOrEmpty() {
        return inputs != null ? inputs : List.of();
    }
}
