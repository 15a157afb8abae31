package com.example.plancompiler.api;

import com.example.plancompiler.definition.DefinitionDiagnostic;
import com.example.plancompiler.validation.ValidationError;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Standard error response body (4xx/5xx): message plus optional plan errors or definition diagnostics.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String message, List<ValidationError> errors, List<DefinitionDiagnostic> diagnostics) {

    public ErrorResponse(String message) {
        this(message, null, null);
    }

    public static ErrorResponse withErrors(String message, List<ValidationError> errors) {
        return new ErrorResponse(message, errors != null ? List.copyOf(errors) : null, null);
    }

    public static ErrorResponse withDiagnostics(String message, List<DefinitionDiagnostic> diagnostics) {
        return new ErrorResponse(message, null, diagnostics != null ? List.copyOf(diagnostics) : null);
    }
}
