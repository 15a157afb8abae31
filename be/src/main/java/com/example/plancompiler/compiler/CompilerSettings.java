package com.example.plancompiler.compiler;

import java.util.Objects;

/**
 * Compiler knobs.
 *
 * @param callbackResource resource invoked by user-input and wait-for-event tasks
 * @param maxWaitSeconds   upper bound for the simulated wait before an event task
 */
public record CompilerSettings(String callbackResource, int maxWaitSeconds) {

    public static final String DEFAULT_CALLBACK_RESOURCE = "arn:aws:lambda:us-east-1:000000000000:function:workflow-plan-callback";
    public static final int DEFAULT_MAX_WAIT_SECONDS = 10;

    public CompilerSettings {
        Objects.requireNonNull(callbackResource, "callbackResource");
        if (maxWaitSeconds < 1) {
            throw new IllegalArgumentException("maxWaitSeconds must be positive: " + maxWaitSeconds);
        }
    }

    public static CompilerSettings defaults() {
        return new CompilerSettings(DEFAULT_CALLBACK_RESOURCE, DEFAULT_MAX_WAIT_SECONDS);
    }
}
