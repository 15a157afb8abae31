package com.example.plancompiler.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DefinitionValidationResult(String result, List<DefinitionDiagnostic> diagnostics) {

    public static final String OK = "OK";
    public static final String FAIL = "FAIL";
    public static final String SKIPPED = "SKIPPED";

    public DefinitionValidationResult {
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public static DefinitionValidationResult skipped() {
        return new DefinitionValidationResult(SKIPPED, List.of());
    }

    /** Anything but an explicit {@code OK} or a skipped check rejects the definition. */
    public boolean isAccepted() {
        return OK.equals(result) || SKIPPED.equals(result);
    }
}
