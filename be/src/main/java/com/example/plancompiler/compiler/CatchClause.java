package com.example.plancompiler.compiler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record CatchClause(List<String> errorEquals, String next, String comment) {

    public static final String ALL_ERRORS = "States.ALL";

    public CatchClause {
        errorEquals = List.copyOf(errorEquals);
    }

    public static CatchClause all(String next, String comment) {
        return new CatchClause(List.of(ALL_ERRORS), next, comment);
    }

    Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("ErrorEquals", errorEquals);
        document.put("Next", next);
        if (comment != null) {
            document.put("Comment", comment);
        }
        return document;
    }
}
