package com.example.plancompiler.service;

import com.example.plancompiler.api.v1.dto.CompileResponse;
import com.example.plancompiler.api.v1.dto.PlanRequest;
import com.example.plancompiler.api.v1.dto.ValidationResponse;
import com.example.plancompiler.compiler.CompilationResult;
import com.example.plancompiler.compiler.StateMachineCompiler;
import com.example.plancompiler.definition.DefinitionDiagnostic;
import com.example.plancompiler.definition.DefinitionValidationResult;
import com.example.plancompiler.definition.StateMachineDefinitionRejectedException;
import com.example.plancompiler.definition.StateMachineDefinitionValidator;
import com.example.plancompiler.domain.CompiledProgram;
import com.example.plancompiler.plan.WorkflowPlan;
import com.example.plancompiler.plan.WorkflowPlanParser;
import com.example.plancompiler.repository.CompiledProgramRepository;
import com.example.plancompiler.tools.StaticToolRegistry;
import com.example.plancompiler.tools.ToolRegistry;
import com.example.plancompiler.validation.ValidationReport;
import com.example.plancompiler.validation.WorkflowPlanValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Application service running a plan through parsing, validation, compilation, the optional
 * definition check and persistence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanCompilationService {

    private final WorkflowPlanParser parser;
    private final ToolRegistry defaultTools;
    private final StateMachineCompiler compiler;
    private final StateMachineDefinitionValidator definitionValidator;
    private final CompiledProgramRepository repository;
    private final JsonMapper jsonMapper;

    /**
     * Parses and validates a plan. Semantic problems are returned in the response; a plan that
     * cannot be parsed at all throws {@link com.example.plancompiler.validation.WorkflowValidationException}.
     */
    public ValidationResponse validate(PlanRequest request) {
        WorkflowPlan plan = parser.parse(request.plan());
        ValidationReport report = WorkflowPlanValidator.inspect(plan, toolsFor(request), request.inputsOrEmpty());
        log.debug("Validated plan name={} nodes={} errors={}", plan.name(), report.nodeCount(), report.errors().size());
        return new ValidationResponse(
                report.isValid(),
                report.nodeCount(),
                report.nodeTypes().stream().sorted().toList(),
                report.errors()
        );
    }

    @Transactional
    public CompileResponse compile(PlanRequest request) {
        WorkflowPlan plan = parser.parse(request.plan());
        ToolRegistry tools = toolsFor(request);
        WorkflowPlanValidator.validate(plan, tools, request.inputsOrEmpty());

        CompilationResult result = compiler.compile(plan, tools);
        if (!result.collisions().isEmpty()) {
            log.warn("Plan name={} has variables sharing a flattened name: {}", plan.name(), result.collisions());
        }
        Map<String, Object> definition = result.program().toDocument();
        String definitionJson = writeJson(definition, "state machine definition");

        DefinitionValidationResult check = definitionValidator.validate(definitionJson);
        if (!check.isAccepted()) {
            log.warn("State machine definition rejected name={} result={} diagnostics={}", plan.name(), check.result(), check.diagnostics());
            throw new StateMachineDefinitionRejectedException(check.result(), check.diagnostics());
        }
        for (DefinitionDiagnostic diagnostic : check.diagnostics()) {
            log.warn("Definition diagnostic name={} {}", plan.name(), diagnostic);
        }

        UUID id = UUID.randomUUID();
        int stateCount = result.program().states().size();
        repository.save(new CompiledProgram(
                id,
                plan.name(),
                definitionJson,
                writeJson(result.inputTemplate(), "input template"),
                stateCount,
                Instant.now()
        ));
        log.debug("Persisted compiled program id={} name={} states={}", id, plan.name(), stateCount);
        return new CompileResponse(id, plan.name(), definition, result.inputTemplate(), stateCount, check.diagnostics());
    }

    private ToolRegistry toolsFor(PlanRequest request) {
        return request.tools() != null ? StaticToolRegistry.of(request.tools()) : defaultTools;
    }

    private String writeJson(Object value, String what) {
        try {
            return jsonMapper.writeValueAsString(value);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize " + what, e);
        }
    }
}
