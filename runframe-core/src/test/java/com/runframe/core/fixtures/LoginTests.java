package com.runframe.core.fixtures;

import com.runframe.api.suite.SuiteContext;
import com.runframe.api.suite.TestFile;

public class LoginTests implements TestFile {

    @Override
    public void define(SuiteContext ctx) {
        ctx.describe("login", () -> {
            ctx.tags("smoke");

            ctx.it("accepts valid credentials", () -> {
            });
            ctx.it("rejects wrong password", () -> {
            });
            ctx.it("locks account after retries", () -> {
            });
        });
    }
}
