package com.runframe.starter.fixtures;

import com.runframe.api.suite.SuiteContext;
import com.runframe.api.suite.TestFile;

public class FailingTests implements TestFile {

    @Override
    public void define(SuiteContext ctx) {
        ctx.describe("failing", () -> ctx.it("always fails", () -> {
            throw new AssertionError("expected failure");
        }));
    }
}
