package com.example.plancompiler.compiler;

import com.example.plancompiler.plan.WorkflowPlan;
import com.example.plancompiler.tools.ToolRegistry;

import java.util.Objects;

/**
 * Compiles validated workflow plans into JSONata state machines.
 * <p>
 * Stateless: every {@link #compile} call starts a fresh {@link CompilationRun} with its own state
 * naming counters and variable registry, so one instance can serve concurrent requests. The plan
 * is assumed to have passed {@link com.example.plancompiler.validation.WorkflowPlanValidator};
 * input it should have rejected aborts with {@link WorkflowCompilationException}.
 * </p>
 */
public class StateMachineCompiler {

    private final CompilerSettings settings;

    public StateMachineCompiler(CompilerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public CompilationResult compile(WorkflowPlan plan, ToolRegistry tools) {
        return new CompilationRun(tools, settings).compile(plan);
    }
}
