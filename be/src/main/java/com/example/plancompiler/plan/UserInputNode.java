package com.example.plancompiler.plan;

import java.util.Collections;
import java.util.ArrayList;
import java.util.List;

/**
 * Pause for a human answer. {@code options} restricts the answer to a fixed set when present.
 */
public record UserInputNode(
        String description,
        String prompt,
        String inputType,
        List<Object> options,
        String outputVariable
) implements WorkflowNode {

    public static final String TYPE = "user_input";

    public UserInputNode {
        options = options != null ? Collections.unmodifiableList(new ArrayList<>(options)) : null;
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
