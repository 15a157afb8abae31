package com.example.plancompiler.plan;

/**
 * Boolean condition guarding a branch or a loop.
 */
public sealed interface Condition permits ComparisonCondition, LogicalCondition {
}
