package com.runframe.core.fixtures;

import com.runframe.api.suite.SuiteContext;
import com.runframe.api.suite.TestFile;

/**
 * 嵌套套件，并通过 loadTestFile 引入另一个测试文件
 */
public class DashboardTests implements TestFile {

    @Override
    public void define(SuiteContext ctx) {
        ctx.describe("dashboard", () -> {
            ctx.beforeEach(() -> {
            });

            ctx.describe("widgets", () -> {
                ctx.tags("smoke");
                ctx.it("renders", () -> {
                });
            });

            ctx.it("loads", () -> {
            });
        });

        ctx.loadTestFile(SearchTests.class.getName());
    }
}
