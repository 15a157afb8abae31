package com.example.plancompiler.api.v1.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A stored program: its state machine definition and the external input it expects.
 */
public record ProgramResponse(
        UUID id,
        String name,
        Map<String, Object> stateMachine,
        Map<String, List<Object>> inputTemplate,
        int stateCount,
        Instant createdAt
) {}
