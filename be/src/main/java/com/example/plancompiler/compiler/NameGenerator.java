package com.example.plancompiler.compiler;

import java.util.HashMap;
import java.util.Map;

/**
 * Hands out unique state names {@code prefix_N}, counting from 1 per prefix.
 * One instance per compilation run.
 */
public final class NameGenerator {

    /** State names are limited to 80 characters; this leaves room for the counter suffix. */
    static final int MAX_PREFIX_LENGTH = 70;

    private final Map<String, Integer> counters = new HashMap<>();

    public String next(String prefix) {
        int count = counters.merge(prefix, 1, Integer::sum);
        return prefix + "_" + count;
    }

    /**
     * Name for a state derived from free text such as a rendered condition, cut to
     * {@value #MAX_PREFIX_LENGTH} characters.
     */
    public String nextFor(String text) {
        String prefix = text.length() > MAX_PREFIX_LENGTH ? text.substring(0, MAX_PREFIX_LENGTH) + "..." : text;
        return next(prefix);
    }
}
