package com.example.plancompiler.validation;

import java.util.Objects;

/**
 * A single validation error: its kind, the path of the offending field
 * (e.g. {@code root.sequence.steps[2].branch.condition.left}) and a message.
 */
public record ValidationError(ValidationErrorKind kind, String field, String message) {
    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }
}
