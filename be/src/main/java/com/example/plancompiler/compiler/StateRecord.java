package com.example.plancompiler.compiler;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One state of the compiled program.
 * <p>
 * A state is created terminal ({@code End: true}) unless it routes elsewhere by construction;
 * lowering later links it with {@link #linkTo(String)}. Only the transition, the
 * {@code Assign} block and the {@code Arguments} change after construction.
 * </p>
 */
@Getter
public final class StateRecord {

    private final StateType type;
    private final StateRole role;
    private final String comment;
    private String resource;
    private final Map<String, Object> arguments = new LinkedHashMap<>();
    private Integer seconds;
    private Integer heartbeatSeconds;
    private final List<ChoiceRule> choices = new ArrayList<>();
    private String defaultNext;
    private final List<SubProgram> branches = new ArrayList<>();
    private final Map<String, Object> assign = new LinkedHashMap<>();
    private final List<CatchClause> catchers = new ArrayList<>();
    /** Flattened variable receiving the task result; {@code null} when the result is discarded. */
    private String outputVariable;
    private String next;
    private boolean end;

    private StateRecord(StateType type, StateRole role, String comment) {
        this.type = type;
        this.role = role;
        this.comment = comment;
    }

    public static StateRecord task(String comment, String resource, Map<String, Object> arguments) {
        StateRecord state = new StateRecord(StateType.TASK, StateRole.PLAIN, comment);
        state.resource = resource;
        state.arguments.putAll(arguments);
        state.end = true;
        return state;
    }

    public static StateRecord pass(String comment, StateRole role) {
        StateRecord state = new StateRecord(StateType.PASS, role, comment);
        state.end = true;
        return state;
    }

    public static StateRecord choice(String comment, ChoiceRule rule, String defaultNext) {
        StateRecord state = new StateRecord(StateType.CHOICE, StateRole.PLAIN, comment);
        state.choices.add(rule);
        state.defaultNext = defaultNext;
        return state;
    }

    public static StateRecord waitSeconds(int seconds, String next) {
        StateRecord state = new StateRecord(StateType.WAIT, StateRole.PLAIN, "Wait " + seconds + " seconds");
        state.seconds = seconds;
        state.next = next;
        return state;
    }

    public static StateRecord parallel(String comment, List<SubProgram> branches, String next) {
        StateRecord state = new StateRecord(StateType.PARALLEL, StateRole.PLAIN, comment);
        state.branches.addAll(branches);
        state.next = next;
        return state;
    }

    /** Routes this state to {@code target} instead of ending. */
    public void linkTo(String target) {
        if (type == StateType.CHOICE) {
            throw new IllegalStateException("Choice states route through their rules, not Next");
        }
        this.end = false;
        this.next = target;
    }

    public void assignResult(String flatVariable) {
        this.outputVariable = flatVariable;
        this.assign.put(flatVariable, Expr.block(Expr.context("states.result")));
    }

    public void heartbeat(int seconds) {
        this.heartbeatSeconds = seconds;
    }

    public void addCatch(CatchClause clause) {
        catchers.add(clause);
    }

    public void replaceAssign(Map<String, Object> values) {
        assign.clear();
        assign.putAll(values);
    }

    public void putArgument(String name, Object value) {
        arguments.put(name, value);
    }

    public Map<String, Object> getAssign() {
        return Collections.unmodifiableMap(assign);
    }

    public Map<String, Object> getArguments() {
        return Collections.unmodifiableMap(arguments);
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("Type", type.value());
        if (type == StateType.TASK) {
            document.put("QueryLanguage", StateMachineProgram.QUERY_LANGUAGE);
        }
        if (comment != null) {
            document.put("Comment", comment);
        }
        if (resource != null) {
            document.put("Resource", resource);
        }
        if (type == StateType.TASK) {
            document.put("Arguments", new LinkedHashMap<>(arguments));
        }
        if (seconds != null) {
            document.put("Seconds", seconds);
        }
        if (heartbeatSeconds != null) {
            document.put("HeartbeatSeconds", heartbeatSeconds);
        }
        if (!choices.isEmpty()) {
            document.put("Choices", choices.stream().map(ChoiceRule::toDocument).toList());
            document.put("Default", defaultNext);
        }
        if (!branches.isEmpty()) {
            document.put("Branches", branches.stream().map(SubProgram::toDocument).toList());
        }
        if (!assign.isEmpty()) {
            document.put("Assign", new LinkedHashMap<>(assign));
        }
        if (!catchers.isEmpty()) {
            document.put("Catch", catchers.stream().map(CatchClause::toDocument).toList());
        }
        if (next != null) {
            document.put("Next", next);
        } else if (end) {
            document.put("End", true);
        }
        return document;
    }

    static Map<String, Object> toDocuments(Map<String, StateRecord> states) {
        Map<String, Object> documents = new LinkedHashMap<>();
        states.forEach((name, state) -> documents.put(name, state.toDocument()));
        return documents;
    }
}
