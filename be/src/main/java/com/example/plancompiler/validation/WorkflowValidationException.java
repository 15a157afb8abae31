package com.example.plancompiler.validation;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a workflow plan cannot be parsed or fails validation.
 * <p>
 * Mapped to HTTP 400 with {@link #getErrors()} in the response body by
 * {@link com.example.plancompiler.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class WorkflowValidationException extends RuntimeException {

    private final List<ValidationError> errors;

    public WorkflowValidationException(List<ValidationError> errors) {
        super("Workflow plan validation failed: " + (errors != null ? errors.size() + " error(s)" : ""));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public WorkflowValidationException(ValidationError error) {
        this(List.of(error));
    }
}
