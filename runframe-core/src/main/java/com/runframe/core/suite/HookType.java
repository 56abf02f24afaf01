package com.runframe.core.suite;

public enum HookType {

    BEFORE_ALL("before all"),

    BEFORE_EACH("before each"),

    AFTER_EACH("after each"),

    AFTER_ALL("after all");

    private final String label;

    HookType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
