package com.example.plancompiler.compiler;

import java.util.LinkedHashMap;
import java.util.Map;

public record ChoiceRule(String condition, String next) {

    Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("Condition", condition);
        document.put("Next", next);
        return document;
    }
}
