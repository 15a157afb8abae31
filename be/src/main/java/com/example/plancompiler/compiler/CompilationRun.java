package com.example.plancompiler.compiler;

import com.example.plancompiler.plan.BranchNode;
import com.example.plancompiler.plan.ComparisonCondition;
import com.example.plancompiler.plan.LoopNode;
import com.example.plancompiler.plan.ParallelNode;
import com.example.plancompiler.plan.SequenceNode;
import com.example.plancompiler.plan.ToolCallNode;
import com.example.plancompiler.plan.UserInputNode;
import com.example.plancompiler.plan.WaitForEventNode;
import com.example.plancompiler.plan.WorkflowNode;
import com.example.plancompiler.plan.WorkflowPlan;
import com.example.plancompiler.tools.ToolDefinition;
import com.example.plancompiler.tools.ToolRegistry;
import com.example.plancompiler.validation.ValidationErrorKind;
import com.example.plancompiler.validation.VariableReferences;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State of a single compilation: state naming and the variable registry live here and die with it.
 */
final class CompilationRun {

    static final String INPUT_STATE = "Input State Variables";
    static final String RECONCILIATION_COMMENT = "Choice Variables";
    static final String PARALLEL_MERGE_COMMENT = "Parallel Variables";

    private static final Logger log = LoggerFactory.getLogger(CompilationRun.class);

    private final ToolRegistry tools;
    private final CompilerSettings settings;
    private final NameGenerator names = new NameGenerator();
    private final VariableRegistry registry = new VariableRegistry();
    private final ConditionTranslator conditions = new ConditionTranslator(registry);

    CompilationRun(ToolRegistry tools, CompilerSettings settings) {
        this.tools = tools;
        this.settings = settings;
    }

    CompilationResult compile(WorkflowPlan plan) {
        Fragment root = lower(plan.root());

        Set<String> produced = new HashSet<>();
        assemble(root.states().values(), produced);
        registry.removeAll(produced);

        Map<String, List<Object>> inputTemplate = registry.snapshot();
        StateRecord input = StateRecord.pass("Initialize state machine variables", StateRole.INPUT);
        Map<String, Object> loads = new LinkedHashMap<>();
        inputTemplate.keySet().forEach(name -> loads.put(name, Expr.block(Expr.context("states.input." + name))));
        input.replaceAssign(loads);
        input.linkTo(root.entry());

        Map<String, StateRecord> states = new LinkedHashMap<>();
        states.put(INPUT_STATE, input);
        states.putAll(root.states());

        log.debug("Compiled plan name={} states={} externalInputs={}", plan.name(), states.size(), inputTemplate.keySet());
        StateMachineProgram program = new StateMachineProgram(plan.name() + ": " + plan.description(), INPUT_STATE, states);
        return new CompilationResult(program, inputTemplate, registry.collisions());
    }

    Fragment lower(WorkflowNode node) {
        if (node instanceof SequenceNode sequence) {
            return sequence(sequence);
        }
        if (node instanceof ParallelNode parallel) {
            return parallel(parallel);
        }
        if (node instanceof ToolCallNode toolCall) {
            return toolCall(toolCall);
        }
        if (node instanceof UserInputNode userInput) {
            return userInput(userInput);
        }
        if (node instanceof BranchNode branch) {
            return branch(branch);
        }
        if (node instanceof LoopNode loop) {
            return loop(loop);
        }
        if (node instanceof WaitForEventNode wait) {
            return waitForEvent(wait);
        }
        throw new WorkflowCompilationException(ValidationErrorKind.UNKNOWN_NODE_KIND,
                "unsupported node type " + node.getClass().getSimpleName());
    }

    private Fragment sequence(SequenceNode sequence) {
        if (sequence.steps().isEmpty()) {
            throw new WorkflowCompilationException(ValidationErrorKind.DEGENERATE_CONTAINER, "sequence without steps");
        }
        Map<String, StateRecord> states = new LinkedHashMap<>();
        Set<String> assigned = new LinkedHashSet<>();
        String entry = null;
        List<String> exits = List.of();
        for (WorkflowNode step : sequence.steps()) {
            Fragment lowered = lower(step);
            states.putAll(lowered.states());
            assigned.addAll(lowered.assigned());
            if (entry == null) {
                entry = lowered.entry();
            } else {
                link(states, exits, lowered.entry());
            }
            exits = lowered.exits();
        }
        return new Fragment(states, entry, exits, assigned);
    }

    private Fragment parallel(ParallelNode parallel) {
        if (parallel.branches().isEmpty()) {
            throw new WorkflowCompilationException(ValidationErrorKind.DEGENERATE_CONTAINER, "parallel without branches");
        }
        String parallelName = names.next("Parallel");
        String mergeName = names.next("Pass");

        List<SubProgram> branches = new ArrayList<>();
        Set<String> assigned = new LinkedHashSet<>();
        for (WorkflowNode branch : parallel.branches()) {
            Fragment lowered = lower(branch);
            branches.add(new SubProgram(lowered.entry(), lowered.states()));
            assigned.addAll(lowered.assigned());
        }

        StateRecord merge = StateRecord.pass(PARALLEL_MERGE_COMMENT, StateRole.PARALLEL_MERGE);
        merge.replaceAssign(placeholders(assigned));

        Map<String, StateRecord> states = new LinkedHashMap<>();
        states.put(parallelName, StateRecord.parallel(orDefault(parallel.description(), "Parallel execution"), branches, mergeName));
        states.put(mergeName, merge);
        return new Fragment(states, parallelName, List.of(mergeName), assigned);
    }

    private Fragment toolCall(ToolCallNode toolCall) {
        ToolDefinition tool = tools.find(toolCall.toolName())
                .orElseThrow(() -> new WorkflowCompilationException(ValidationErrorKind.UNKNOWN_TOOL,
                        "unknown tool '" + toolCall.toolName() + "'"));
        String resource = tool.resource();
        if (resource == null || resource.isBlank()) {
            log.debug("Tool {} declares no resource, using callback resource {}", tool.name(), settings.callbackResource());
            resource = settings.callbackResource();
        }
        String name = names.next(toolCall.toolName());
        StateRecord task = StateRecord.task(
                orDefault(toolCall.description(), "Call " + toolCall.toolName()),
                resource,
                rewriteArguments(toolCall.parameters()));

        Map<String, StateRecord> states = new LinkedHashMap<>();
        states.put(name, task);
        Set<String> assigned = new LinkedHashSet<>();
        assignOutput(task, toolCall.outputVariable(), assigned);

        if (toolCall.errorHandler() == null) {
            return new Fragment(states, name, List.of(name), assigned);
        }
        Fragment handler = lower(toolCall.errorHandler());
        task.addCatch(CatchClause.all(handler.entry(), "Handle tool call errors"));
        states.putAll(handler.states());
        assigned.addAll(handler.assigned());
        List<String> exits = new ArrayList<>(handler.exits());
        exits.add(name);
        return new Fragment(states, name, exits, assigned);
    }

    private Fragment userInput(UserInputNode userInput) {
        String name = names.next("UserInput");
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("prompt", rewrite(orDefault(userInput.prompt(), "Prompt for user input")));
        arguments.put("inputType", orDefault(userInput.inputType(), "text"));
        if (userInput.options() != null) {
            arguments.put("options", rewrite(userInput.options()));
        }
        StateRecord task = StateRecord.task(
                orDefault(userInput.description(), "Wait for user input"),
                settings.callbackResource(),
                arguments);

        Set<String> assigned = new LinkedHashSet<>();
        assignOutput(task, userInput.outputVariable(), assigned);
        Map<String, StateRecord> states = new LinkedHashMap<>();
        states.put(name, task);
        return new Fragment(states, name, List.of(name), assigned);
    }

    private Fragment waitForEvent(WaitForEventNode wait) {
        int max = settings.maxWaitSeconds();
        int seconds = Math.max(1, Math.min(wait.timeout() != null ? wait.timeout() : max, max));
        String waitName = names.next("Wait" + seconds + "Seconds");
        String taskName = names.next("WaitFor_" + wait.eventType());

        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("eventType", wait.eventType());
        arguments.put("eventSource", wait.eventSource());
        if (wait.entityId() != null) {
            arguments.put("entityId", rewrite(wait.entityId()));
        }
        StateRecord task = StateRecord.task(
                orDefault(wait.description(), "Wait for " + wait.eventType() + " from " + wait.eventSource()),
                settings.callbackResource(),
                arguments);
        task.heartbeat(seconds);

        Map<String, StateRecord> states = new LinkedHashMap<>();
        states.put(waitName, StateRecord.waitSeconds(seconds, taskName));
        states.put(taskName, task);
        Set<String> assigned = new LinkedHashSet<>();
        assignOutput(task, wait.outputVariable(), assigned);

        if (wait.onTimeout() == null) {
            return new Fragment(states, waitName, List.of(taskName), assigned);
        }
        String checkName = names.next("WaitFor_" + wait.eventType() + "_ResultCheck");
        String receivedName = names.next("Pass");
        Fragment handler = lower(wait.onTimeout());

        String timedOut = Expr.block(Expr.binary(Expr.literal("error"), "in", Expr.context("states.input")));
        task.linkTo(checkName);
        states.put(checkName, StateRecord.choice(
                "Check " + wait.eventType() + " result",
                new ChoiceRule(timedOut, handler.entry()),
                receivedName));
        states.put(receivedName, StateRecord.pass("Received " + wait.eventType() + " in wait state", StateRole.PLAIN));
        states.putAll(handler.states());
        assigned.addAll(handler.assigned());

        List<String> exits = new ArrayList<>(handler.exits());
        exits.add(receivedName);
        return new Fragment(states, waitName, exits, assigned);
    }

    private Fragment branch(BranchNode branch) {
        String condition = Expr.block(conditions.translate(branch.condition()));
        String choiceName = names.nextFor(condition);
        Fragment ifTrue = lower(branch.ifTrue());
        Fragment ifFalse = lower(branch.ifFalse());
        String trueJoin = names.next("Pass");
        String falseJoin = names.next("Pass");

        Map<String, StateRecord> states = new LinkedHashMap<>();
        states.put(choiceName, StateRecord.choice(
                orDefault(branch.description(), "Conditional branch"),
                new ChoiceRule(condition, ifTrue.entry()),
                ifFalse.entry()));
        states.putAll(ifTrue.states());
        states.putAll(ifFalse.states());

        // each side declares what only the other side assigns
        StateRecord trueReconciliation = StateRecord.pass(RECONCILIATION_COMMENT, StateRole.RECONCILIATION);
        trueReconciliation.replaceAssign(placeholders(ifFalse.assigned()));
        StateRecord falseReconciliation = StateRecord.pass(RECONCILIATION_COMMENT, StateRole.RECONCILIATION);
        falseReconciliation.replaceAssign(placeholders(ifTrue.assigned()));
        states.put(trueJoin, trueReconciliation);
        states.put(falseJoin, falseReconciliation);

        link(states, ifTrue.exits(), trueJoin);
        link(states, ifFalse.exits(), falseJoin);
        return new Fragment(states, choiceName, List.of(trueJoin, falseJoin), Set.of());
    }

    private Fragment loop(LoopNode loop) {
        String condition = Expr.block(conditions.translate(loop.condition()));
        String choiceName = names.nextFor(condition);
        Fragment body = lower(loop.body());
        String doneName = names.next("Pass");

        Map<String, StateRecord> states = new LinkedHashMap<>();
        states.put(choiceName, StateRecord.choice(
                orDefault(loop.description(), "Check loop condition"),
                new ChoiceRule(condition, body.entry()),
                doneName));
        states.putAll(body.states());
        states.put(doneName, StateRecord.pass("Loop completed", StateRole.PLAIN));

        if (loop.condition() instanceof ComparisonCondition comparison && comparison.operator().isOrdering()) {
            String counter = VariableReferences.flatten(ConditionTranslator.leftVariable(comparison));
            String iteratorName = names.next("IteratorControl");
            StateRecord iterator = StateRecord.pass("Loop iterator increment", StateRole.ITERATOR);
            iterator.replaceAssign(Map.of(counter,
                    Expr.block(Expr.binary(new Expr.Var(counter), "+", Expr.literal(1)))));
            iterator.linkTo(choiceName);
            states.put(iteratorName, iterator);
            link(states, body.exits(), iteratorName);
        } else {
            link(states, body.exits(), choiceName);
        }
        return new Fragment(states, choiceName, List.of(doneName), body.assigned());
    }

    /**
     * Replaces naive result assignments and placeholders with the sub-fields the program actually
     * reads, recording every name produced inside the program.
     */
    private void assemble(Collection<StateRecord> states, Set<String> produced) {
        for (StateRecord state : states) {
            if (state.getType() == StateType.TASK && state.getOutputVariable() != null) {
                List<String> fields = registry.namesUnder(state.getOutputVariable());
                Map<String, Object> returnRange = new LinkedHashMap<>();
                if (!fields.isEmpty()) {
                    Map<String, Object> assign = new LinkedHashMap<>();
                    for (String field : fields) {
                        returnRange.put(field, registry.range(field));
                        assign.put(field, Expr.block(Expr.context("states.result." + field)));
                    }
                    state.replaceAssign(assign);
                    produced.addAll(fields);
                }
                state.putArgument("ReturnValueRange", returnRange);
            } else if (state.getRole() == StateRole.RECONCILIATION || state.getRole() == StateRole.PARALLEL_MERGE) {
                Map<String, Object> expanded = new LinkedHashMap<>();
                for (String placeholder : state.getAssign().keySet()) {
                    registry.namesUnder(placeholder).forEach(field -> expanded.put(field, null));
                }
                state.replaceAssign(expanded);
                produced.addAll(expanded.keySet());
            } else if (state.getType() == StateType.PARALLEL) {
                for (SubProgram branch : state.getBranches()) {
                    assemble(branch.states().values(), produced);
                }
            }
        }
    }

    private void assignOutput(StateRecord task, String outputVariable, Set<String> assigned) {
        if (outputVariable == null || outputVariable.isBlank()) {
            return;
        }
        String flat = VariableReferences.flatten(outputVariable);
        task.assignResult(flat);
        assigned.add(flat);
    }

    private Map<String, Object> rewriteArguments(Map<String, Object> parameters) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        parameters.forEach((key, value) -> arguments.put(key, rewrite(value)));
        return arguments;
    }

    /**
     * Flattens the variables of every whole {@code {% ... %}} string, registering them as inputs of unknown range.
     */
    private Object rewrite(Object value) {
        if (value instanceof String text) {
            if (!VariableReferences.isWholeBlock(text)) {
                return text;
            }
            VariableReferences.variables(text).forEach(name -> registry.register(name, null));
            return VariableReferences.flattenReferences(text);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> rewritten = new LinkedHashMap<>();
            map.forEach((key, item) -> rewritten.put(String.valueOf(key), rewrite(item)));
            return rewritten;
        }
        if (value instanceof List<?> list) {
            List<Object> rewritten = new ArrayList<>(list.size());
            list.forEach(item -> rewritten.add(rewrite(item)));
            return rewritten;
        }
        return value;
    }

    private static Map<String, Object> placeholders(Set<String> variables) {
        Map<String, Object> assign = new LinkedHashMap<>();
        variables.forEach(name -> assign.put(name, null));
        return assign;
    }

    private static void link(Map<String, StateRecord> states, List<String> exits, String target) {
        for (String exit : exits) {
            states.get(exit).linkTo(target);
        }
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
