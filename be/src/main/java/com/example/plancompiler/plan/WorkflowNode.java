package com.example.plancompiler.plan;

/**
 * A node of a workflow plan tree.
 * <p>
 * The set of node kinds is closed: compiler and validator dispatch over the permitted records
 * and every new kind must be handled in both.
 * </p>
 */
public sealed interface WorkflowNode
        permits SequenceNode, ParallelNode, ToolCallNode, UserInputNode, BranchNode, LoopNode, WaitForEventNode {

    /** Optional free-text description; may be {@code null}. */
    String description();

    /** The JSON tag of this node kind, e.g. {@code tool_call}. */
    String typeName();
}
