package com.qamigrate.compiler.extraction;

public enum StepKind {
    ACTION("action"),
    ASSERTION("assertion");

    private final String value;

    StepKind(String value) {
        this.value = value;
    }

    /** Lower-case form written to the IR. */
    public String value() {
        return value;
    }
}
