package com.example.plancompiler.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA entity for a compiled workflow plan.
 * <p>
 * Stores the state machine definition and the external input template as JSON in
 * {@code definition_json} and {@code input_template_json}.
 * </p>
 */
@Entity
@Table(name = "compiled_program")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CompiledProgram {

    @Id
    private UUID id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(name = "definition_json", nullable = false, columnDefinition = "CLOB")
    private String definitionJson;

    @Column(name = "input_template_json", nullable = false, columnDefinition = "CLOB")
    private String inputTemplateJson;

    @Column(name = "state_count", nullable = false)
    private int stateCount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public CompiledProgram(UUID id, String name, String definitionJson, String inputTemplateJson, int stateCount, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.definitionJson = Objects.requireNonNull(definitionJson, "definitionJson");
        this.inputTemplateJson = Objects.requireNonNull(inputTemplateJson, "inputTemplateJson");
        this.stateCount = stateCount;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }
}
