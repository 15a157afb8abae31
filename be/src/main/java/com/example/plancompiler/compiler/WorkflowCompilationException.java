package com.example.plancompiler.compiler;

import com.example.plancompiler.validation.ValidationErrorKind;

import lombok.Getter;

/**
 * Thrown when the compiler meets input that validation should have rejected.
 * Compilation stops at the first such problem.
 */
@Getter
public class WorkflowCompilationException extends RuntimeException {

    private final ValidationErrorKind kind;

    public WorkflowCompilationException(ValidationErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
