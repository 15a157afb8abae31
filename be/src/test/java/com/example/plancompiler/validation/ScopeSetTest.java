package com.example.plancompiler.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScopeSetTest {

    @Test
    @DisplayName("with returns a new set and leaves the original untouched")
    void withIsPersistent() {
        ScopeSet base = ScopeSet.of("a");
        ScopeSet extended = base.with("b");

        assertThat(base.names()).containsExactly("a");
        assertThat(extended.names()).containsExactly("a", "b");
        assertSame(base, base.with(null));
        assertSame(base, base.with("a"));
    }

    @Test
    @DisplayName("defines a dotted reference when a prefix is in scope")
    void dottedPrefixes() {
        ScopeSet scope = ScopeSet.of("order");

        assertTrue(scope.defines("order"));
        assertTrue(scope.defines("order.customer.email"));
        assertFalse(scope.defines("orders"));
        assertFalse(scope.defines("customer.order"));
    }

    @Test
    @DisplayName("union joins both sides")
    void union() {
        ScopeSet joined = ScopeSet.of("x").union(ScopeSet.of("y", "z"));

        assertThat(joined.names()).containsExactly("x", "y", "z");
        assertThat(ScopeSet.empty().names()).isEmpty();
    }
}
