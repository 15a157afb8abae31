package com.example.plancompiler.compiler;

import com.example.plancompiler.validation.VariableReferences;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Set;

/**
 * JSONata expression tree used to synthesize conditions and assignments.
 * <p>
 * Expressions are built compositionally and rendered to text only when a state is emitted;
 * {@link #block(Expr)} wraps the rendered text in {@code {% ... %}}.
 * </p>
 */
public sealed interface Expr permits Expr.Var, Expr.Literal, Expr.BinOp {

    int ATOM = 10;

    String render();

    default int precedence() {
        return ATOM;
    }

    /** A plan variable, flattened to its state machine name. */
    static Var variable(String dottedName) {
        return new Var(VariableReferences.flatten(dottedName));
    }

    /** A path into the execution context, e.g. {@code states.input}; kept dotted. */
    static Var context(String path) {
        return new Var(path);
    }

    static Literal literal(Object value) {
        return new Literal(value);
    }

    static BinOp binary(Expr left, String operator, Expr right) {
        return new BinOp(left, operator, right);
    }

    static String block(Expr expr) {
        return VariableReferences.OPEN + " " + expr.render() + " " + VariableReferences.CLOSE;
    }

    record Var(String name) implements Expr {
        public Var {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String render() {
            return "$" + name;
        }
    }

    record Literal(Object value) implements Expr {
        @Override
        public String render() {
            if (value == null) {
                return "null";
            }
            if (value instanceof String text) {
                // JSONata has no \' escape, so text holding a single quote goes in double quotes
                char quote = text.indexOf('\'') >= 0 ? '"' : '\'';
                return quote + escape(text, quote) + quote;
            }
            if (value instanceof BigDecimal decimal) {
                return decimal.toPlainString();
            }
            return String.valueOf(value);
        }

        private static String escape(String text, char quote) {
            StringBuilder out = new StringBuilder(text.length());
            for (char c : text.toCharArray()) {
                if (c == '\\' || c == quote) {
                    out.append('\\').append(c);
                } else if (c == '\n') {
                    out.append("\\n");
                } else if (c == '\r') {
                    out.append("\\r");
                } else if (c == '\t') {
                    out.append("\\t");
                } else {
                    out.append(c);
                }
            }
            return out.toString();
        }
    }

    record BinOp(Expr left, String operator, Expr right) implements Expr {

        private static final Set<String> COMPARISONS = Set.of("=", "!=", "<", "<=", ">", ">=", "in");

        public BinOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public int precedence() {
            if ("or".equals(operator)) {
                return 1;
            }
            if ("and".equals(operator)) {
                return 2;
            }
            if (COMPARISONS.contains(operator)) {
                return 3;
            }
            return 4;
        }

        @Override
        public String render() {
            return operand(left, false) + " " + operator + " " + operand(right, true);
        }

        private String operand(Expr operand, boolean rightSide) {
            boolean group = operand.precedence() < precedence()
                    || (rightSide && operand.precedence() == precedence() && operand instanceof BinOp);
            return group ? "(" + operand.render() + ")" : operand.render();
        }
    }
}
