package com.example.plancompiler.compiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One branch of a {@code Parallel} state: its own start state and state map.
 */
public record SubProgram(String startAt, Map<String, StateRecord> states) {

    public SubProgram {
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("StartAt", startAt);
        document.put("States", StateRecord.toDocuments(states));
        return document;
    }
}
