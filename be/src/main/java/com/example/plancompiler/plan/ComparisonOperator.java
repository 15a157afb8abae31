package com.example.plancompiler.plan;

import java.util.Arrays;
import java.util.Optional;

public enum ComparisonOperator {
    EQ("==", "="),
    NE("!=", "!="),
    LT("<", "<"),
    LE("<=", "<="),
    GT(">", ">"),
    GE(">=", ">="),
    IN("in", "in");

    private final String symbol;
    private final String jsonata;

    ComparisonOperator(String symbol, String jsonata) {
        this.symbol = symbol;
        this.jsonata = jsonata;
    }

    /** The operator as written in workflow plans. */
    public String symbol() {
        return symbol;
    }

    /** The operator as written in JSONata; equality is a single {@code =}. */
    public String jsonata() {
        return jsonata;
    }

    /**
     * Ordering comparisons drive counting loops: the compiler emits an increment of the left
     * operand after each iteration.
     */
    public boolean isOrdering() {
        return this == LT || this == LE || this == GT || this == GE;
    }

    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol))
                .findFirst();
    }
}
