package com.example.plancompiler.validation;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable set of variable names defined at a point of the plan.
 * <p>
 * Adding a name returns a new set, so a scope handed to two branches cannot be changed by either.
 * </p>
 */
public final class ScopeSet {

    private static final ScopeSet EMPTY = new ScopeSet(new TreeSet<>());

    private final Set<String> names;

    private ScopeSet(TreeSet<String> names) {
        this.names = Collections.unmodifiableSet(names);
    }

    public static ScopeSet empty() {
        return EMPTY;
    }

    public static ScopeSet of(String... names) {
        TreeSet<String> set = new TreeSet<>();
        Collections.addAll(set, names);
        return new ScopeSet(set);
    }

    public ScopeSet with(String name) {
        if (name == null || name.isBlank() || names.contains(name)) {
            return this;
        }
        TreeSet<String> copy = new TreeSet<>(names);
        copy.add(name);
        return new ScopeSet(copy);
    }

    public ScopeSet union(ScopeSet other) {
        if (other.names.isEmpty()) {
            return this;
        }
        TreeSet<String> copy = new TreeSet<>(names);
        copy.addAll(other.names);
        return new ScopeSet(copy);
    }

    /**
     * Whether {@code reference} (dotted) is defined: the name itself or one of its dotted prefixes is in scope.
     */
    public boolean defines(String reference) {
        String candidate = reference;
        while (true) {
            if (names.contains(candidate)) {
                return true;
            }
            int dot = candidate.lastIndexOf('.');
            if (dot < 0) {
                return false;
            }
            candidate = candidate.substring(0, dot);
        }
    }

    public Set<String> names() {
        return names;
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
