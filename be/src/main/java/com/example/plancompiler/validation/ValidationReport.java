package com.example.plancompiler.validation;

import java.util.List;
import java.util.Set;

/**
 * Outcome of inspecting a plan: all accumulated errors plus node statistics.
 */
public record ValidationReport(List<ValidationError> errors, int nodeCount, Set<String> nodeTypes) {

    public ValidationReport {
        errors = List.copyOf(errors);
        nodeTypes = Set.copyOf(nodeTypes);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
