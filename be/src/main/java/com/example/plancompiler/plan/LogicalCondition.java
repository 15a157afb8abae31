package com.example.plancompiler.plan;

import java.util.List;
import java.util.Objects;

public record LogicalCondition(LogicalOperator operator, List<Condition> conditions) implements Condition {

    public static final String TYPE = "logical";

    public LogicalCondition {
        Objects.requireNonNull(operator, "operator");
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }
}
