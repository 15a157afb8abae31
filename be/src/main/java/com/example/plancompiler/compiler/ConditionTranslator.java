package com.example.plancompiler.compiler;

import com.example.plancompiler.plan.ComparisonCondition;
import com.example.plancompiler.plan.Condition;
import com.example.plancompiler.plan.LogicalCondition;
import com.example.plancompiler.validation.ValidationErrorKind;
import com.example.plancompiler.validation.VariableReferences;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * Translates plan conditions into JSONata expressions and registers the variables they read,
 * with a demo value range derived from the value they are compared against.
 */
final class ConditionTranslator {

    private static final List<Object> REFERENCE_RANGE = List.of(1, 2, 3, 4, 5);

    private final VariableRegistry registry;

    ConditionTranslator(VariableRegistry registry) {
        this.registry = registry;
    }

    Expr translate(Condition condition) {
        if (condition instanceof ComparisonCondition comparison) {
            return comparison(comparison);
        }
        if (condition instanceof LogicalCondition logical) {
            if (logical.conditions().isEmpty()) {
                throw new WorkflowCompilationException(ValidationErrorKind.UNSUPPORTED_CONDITION_KIND,
                        "logical condition without sub-conditions");
            }
            Expr joined = null;
            for (Condition sub : logical.conditions()) {
                Expr expr = translate(sub);
                joined = joined == null ? expr : Expr.binary(joined, logical.operator().symbol(), expr);
            }
            return joined;
        }
        throw new WorkflowCompilationException(ValidationErrorKind.UNSUPPORTED_CONDITION_KIND,
                "unsupported condition " + condition);
    }

    /**
     * The dotted variable name a comparison's left operand reads.
     */
    static String leftVariable(ComparisonCondition comparison) {
        if (comparison.left() instanceof String left) {
            return VariableReferences.singleReference(left)
                    .orElseThrow(() -> new WorkflowCompilationException(ValidationErrorKind.MALFORMED_VARIABLE_REFERENCE,
                            "condition left operand is not a variable reference: " + left));
        }
        throw new WorkflowCompilationException(ValidationErrorKind.INVALID_VALUE_TYPE,
                "condition left operand is not a string: " + comparison.left());
    }

    private Expr comparison(ComparisonCondition comparison) {
        String left = leftVariable(comparison);
        String operator = comparison.operator().jsonata();
        Object right = comparison.right();

        if (right instanceof String text && VariableReferences.singleReference(text).isPresent()) {
            String rightName = VariableReferences.singleReference(text).get();
            registry.register(left, REFERENCE_RANGE);
            registry.register(rightName, REFERENCE_RANGE);
            return Expr.binary(Expr.variable(left), operator, Expr.variable(rightName));
        }
        if (right == null) {
            registry.register(left, Arrays.asList(null, "NOT_NULL"));
            return Expr.binary(Expr.variable(left), operator, Expr.literal(null));
        }
        if (right instanceof String text) {
            registry.register(left, List.of(text, "NOT_" + text));
            return Expr.binary(Expr.variable(left), operator, Expr.literal(text));
        }
        if (right instanceof Boolean flag) {
            registry.register(left, List.of(!flag, flag));
            return Expr.binary(Expr.variable(left), operator, Expr.literal(flag));
        }
        if (right instanceof Number number) {
            registry.register(left, around(number));
            return Expr.binary(Expr.variable(left), operator, Expr.literal(number));
        }
        throw new WorkflowCompilationException(ValidationErrorKind.INVALID_VALUE_TYPE,
                "unsupported right operand type " + right.getClass().getSimpleName() + " in condition on $" + left);
    }

    private static List<Object> around(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte) {
            long value = number.longValue();
            return List.of(value - 1, value, value + 1);
        }
        if (number instanceof BigInteger value) {
            return List.of(value.subtract(BigInteger.ONE), value, value.add(BigInteger.ONE));
        }
        if (number instanceof BigDecimal value) {
            return List.of(value.subtract(BigDecimal.ONE), value, value.add(BigDecimal.ONE));
        }
        double value = number.doubleValue();
        return List.of(value - 1, value, value + 1);
    }
}
