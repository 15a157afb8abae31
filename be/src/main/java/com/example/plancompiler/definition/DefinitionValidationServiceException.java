package com.example.plancompiler.definition;

/**
 * The definition validation service could not be reached or answered with an error.
 * Mapped to HTTP 502 with the original message.
 */
public class DefinitionValidationServiceException extends RuntimeException {

    public DefinitionValidationServiceException(String message) {
        super(message);
    }

    public DefinitionValidationServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
