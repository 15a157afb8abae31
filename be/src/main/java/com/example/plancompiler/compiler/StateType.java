package com.example.plancompiler.compiler;

public enum StateType {
    TASK("Task"),
    PASS("Pass"),
    CHOICE("Choice"),
    WAIT("Wait"),
    PARALLEL("Parallel");

    private final String value;

    StateType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
