package com.example.plancompiler.api;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a compiled program is not found by id.
 * <p>
 * Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class CompiledProgramNotFoundException extends RuntimeException {

    private final UUID programId;

    public CompiledProgramNotFoundException(UUID programId) {
        super("Compiled program not found: " + programId);
        this.programId = programId;
    }
}
