package com.example.plancompiler.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One finding reported by the definition validation service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DefinitionDiagnostic(String severity, String code, String message, String location) {

    @Override
    public String toString() {
        return severity + ": " + code + ", " + message + " at " + location;
    }
}
