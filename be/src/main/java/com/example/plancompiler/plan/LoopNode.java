package com.example.plancompiler.plan;

import java.util.Objects;

/**
 * Repeats {@code body} while {@code condition} holds.
 */
public record LoopNode(String description, Condition condition, WorkflowNode body) implements WorkflowNode {

    public static final String TYPE = "loop";

    public LoopNode {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
