package com.example.plancompiler.plan;

import java.util.Objects;

/**
 * {@code left operator right}. {@code left} is a {@code {% $var %}} reference as written in the plan;
 * {@code right} is either another reference string or a literal (string, number, boolean or null).
 */
public record ComparisonCondition(Object left, ComparisonOperator operator, Object right) implements Condition {

    public static final String TYPE = "comparison";

    public ComparisonCondition {
        Objects.requireNonNull(operator, "operator");
    }
}
