package com.example.plancompiler.api.v1.dto;

import com.example.plancompiler.definition.DefinitionDiagnostic;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A freshly compiled and stored program.
 */
public record CompileResponse(
        UUID id,
        String name,
        Map<String, Object> stateMachine,
        Map<String, List<Object>> inputTemplate,
        int stateCount,
        List<DefinitionDiagnostic> diagnostics
) {}
