package com.example.plancompiler.plan;

import java.util.List;

/**
 * Ordered steps executed one after another.
 */
public record SequenceNode(String description, List<WorkflowNode> steps) implements WorkflowNode {

    public static final String TYPE = "sequence";

    public SequenceNode {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
