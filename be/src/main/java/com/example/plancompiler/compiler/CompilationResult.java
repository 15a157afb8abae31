package com.example.plancompiler.compiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A compiled program plus the external input it expects.
 *
 * @param program       the state machine
 * @param inputTemplate variables the caller must supply, each with demo values for simulated runs
 * @param collisions    flattened names shared by distinct dotted variables
 */
public record CompilationResult(StateMachineProgram program, Map<String, List<Object>> inputTemplate, Set<String> collisions) {

    public CompilationResult {
        inputTemplate = Collections.unmodifiableMap(new LinkedHashMap<>(inputTemplate));
        collisions = Set.copyOf(collisions);
    }
}
