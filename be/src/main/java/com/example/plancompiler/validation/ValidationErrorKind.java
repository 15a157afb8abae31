package com.example.plancompiler.validation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a plan validation error, serialized in PascalCase (e.g. {@code UndefinedVariable}).
 */
public enum ValidationErrorKind {
    MALFORMED_EMBEDDED_JSON("MalformedEmbeddedJson"),
    DEGENERATE_CONTAINER("DegenerateContainer"),
    DISALLOWED_EXPRESSION_SYNTAX("DisallowedExpressionSyntax"),
    MALFORMED_VARIABLE_REFERENCE("MalformedVariableReference"),
    UNDEFINED_VARIABLE("UndefinedVariable"),
    UNKNOWN_TOOL("UnknownTool"),
    UNKNOWN_PARAMETER("UnknownParameter"),
    MISSING_REQUIRED_PARAMETER("MissingRequiredParameter"),
    UNKNOWN_NODE_KIND("UnknownNodeKind"),
    UNSUPPORTED_CONDITION_KIND("UnsupportedConditionKind"),
    MISSING_REQUIRED_FIELD("MissingRequiredField"),
    INVALID_VALUE_TYPE("InvalidValueType");

    private final String code;

    ValidationErrorKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
