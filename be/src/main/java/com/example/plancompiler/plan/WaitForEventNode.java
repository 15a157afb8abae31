package com.example.plancompiler.plan;

import java.util.Objects;

/**
 * Waits for an external event of {@code eventType} emitted by {@code eventSource}.
 * <p>
 * {@code entityId} optionally narrows the event to one entity and must be a single variable
 * reference. {@code timeout} is in seconds; {@code onTimeout} runs when the wait reports an error.
 * </p>
 */
public record WaitForEventNode(
        String description,
        String eventType,
        String eventSource,
        String entityId,
        Integer timeout,
        String outputVariable,
        WorkflowNode onTimeout
) implements WorkflowNode {

    public static final String TYPE = "wait_for_event";

    public WaitForEventNode {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(eventSource, "eventSource");
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
