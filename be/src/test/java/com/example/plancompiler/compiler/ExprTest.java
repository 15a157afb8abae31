package com.example.plancompiler.compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExprTest {

    private static final Expr A = Expr.variable("a");
    private static final Expr B = Expr.variable("b");
    private static final Expr C = Expr.variable("c");

    @Test
    @DisplayName("renders literals as JSONata values")
    void literals() {
        assertEquals("'done'", Expr.literal("done").render());
        assertEquals("\"it's\"", Expr.literal("it's").render());
        assertEquals("\"say \\\"it's\\\"\"", Expr.literal("say \"it's\"").render());
        assertEquals("'a\\\\b\\n'", Expr.literal("a\\b\n").render());
        assertEquals("null", Expr.literal(null).render());
        assertEquals("true", Expr.literal(true).render());
        assertEquals("0.00001", Expr.literal(new BigDecimal("1E-5")).render());
    }

    @Test
    @DisplayName("parenthesizes only where precedence requires it")
    void precedence() {
        assertEquals("$a and $b or $c",
                Expr.binary(Expr.binary(A, "and", B), "or", C).render());
        assertEquals("$a and ($b or $c)",
                Expr.binary(A, "and", Expr.binary(B, "or", C)).render());
        assertEquals("$a or $b and $c",
                Expr.binary(A, "or", Expr.binary(B, "and", C)).render());
        assertEquals("$a = 1 and $b > 2",
                Expr.binary(Expr.binary(A, "=", Expr.literal(1)), "and", Expr.binary(B, ">", Expr.literal(2))).render());
    }

    @Test
    @DisplayName("flattens plan variables but keeps context paths dotted")
    void variables() {
        assertEquals("$order_id", Expr.variable("order.id").render());
        assertEquals("{% $states.result.x %}", Expr.block(Expr.context("states.result.x")));
    }
}
