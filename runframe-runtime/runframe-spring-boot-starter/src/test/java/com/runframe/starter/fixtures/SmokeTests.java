package com.runframe.starter.fixtures;

import com.runframe.api.suite.SuiteContext;
import com.runframe.api.suite.TestFile;

public class SmokeTests implements TestFile {

    @Override
    public void define(SuiteContext ctx) {
        ctx.describe("smoke", () -> {
            ctx.it("starts", () -> {
            });
            ctx.it("stops", () -> {
            });
        });
    }
}
