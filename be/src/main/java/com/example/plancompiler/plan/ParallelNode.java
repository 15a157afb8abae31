package com.example.plancompiler.plan;

import java.util.List;

/**
 * Branches executed concurrently; the node completes when all branches complete.
 */
public record ParallelNode(String description, List<WorkflowNode> branches) implements WorkflowNode {

    public static final String TYPE = "parallel";

    public ParallelNode {
        branches = branches != null ? List.copyOf(branches) : List.of();
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
