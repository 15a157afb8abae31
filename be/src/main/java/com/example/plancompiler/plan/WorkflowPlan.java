package com.example.plancompiler.plan;

import java.util.Objects;

/**
 * A parsed workflow plan: a named tree rooted at {@code root}.
 */
public record WorkflowPlan(String name, String description, WorkflowNode root) {

    public WorkflowPlan {
        Objects.requireNonNull(root, "root");
        name = name != null ? name : "workflow";
        description = description != null ? description : "";
    }
}
