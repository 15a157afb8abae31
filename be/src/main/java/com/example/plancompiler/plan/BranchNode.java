package com.example.plancompiler.plan;

import java.util.Objects;

public record BranchNode(String description, Condition condition, WorkflowNode ifTrue, WorkflowNode ifFalse)
        implements WorkflowNode {

    public static final String TYPE = "branch";

    public BranchNode {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(ifTrue, "ifTrue");
        Objects.requireNonNull(ifFalse, "ifFalse");
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
