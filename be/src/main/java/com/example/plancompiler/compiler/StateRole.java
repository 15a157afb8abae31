package com.example.plancompiler.compiler;

/**
 * Why a state was synthesized. Program assembly rewrites states by role.
 */
public enum StateRole {
    /** Emitted for a plan node or control flow; never rewritten. */
    PLAIN,
    /** Declares, on one side of a branch, the variables only the other side assigns. */
    RECONCILIATION,
    /** Declares the variables assigned by the branches of a parallel state. */
    PARALLEL_MERGE,
    /** Advances a counting loop's variable. */
    ITERATOR,
    /** Loads externally supplied variables at program start. */
    INPUT
}
