package com.runframe.core.suite;

import com.runframe.api.suite.TestBody;

/**
 * 套件钩子
 */
public class Hook extends TestRunnable {

    private final HookType type;

    public Hook(HookType type, Suite parent, TestBody body) {
        super("\"" + type.getLabel() + "\" hook", parent, body);
        this.type = type;
    }

    public HookType getType() {
        return type;
    }
}
