package com.example.plancompiler.definition;

import lombok.Getter;

import java.util.List;

/**
 * The validation service found the compiled definition invalid.
 */
@Getter
public class StateMachineDefinitionRejectedException extends RuntimeException {

    private final List<DefinitionDiagnostic> diagnostics;

    public StateMachineDefinitionRejectedException(String result, List<DefinitionDiagnostic> diagnostics) {
        super("State machine definition is invalid: " + result);
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }
}
