package com.example.plancompiler.api.v1.dto;

import java.time.Instant;
import java.util.UUID;

public record ProgramListItem(
        UUID id,
        String name,
        int stateCount,
        Instant createdAt
) {}
