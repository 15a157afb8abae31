package com.example.plancompiler.compiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A compiled state machine. {@link #toDocument()} renders the JSON definition.
 */
public record StateMachineProgram(String comment, String startAt, Map<String, StateRecord> states) {

    public static final String QUERY_LANGUAGE = "JSONata";

    public StateMachineProgram {
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    public StateRecord state(String name) {
        return states.get(name);
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("Comment", comment);
        document.put("StartAt", startAt);
        document.put("QueryLanguage", QUERY_LANGUAGE);
        document.put("States", StateRecord.toDocuments(states));
        return document;
    }
}
