package com.example.plancompiler.api.v1.dto;

import com.example.plancompiler.validation.ValidationError;

import java.util.List;

/**
 * Outcome of validating a plan: every error found plus node statistics.
 */
public record ValidationResponse(
        boolean valid,
        int nodeCount,
        List<String> nodeTypes,
        List<ValidationError> errors
) {}
