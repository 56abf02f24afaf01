package com.runframe.core.fixtures;

import com.runframe.api.provider.ProviderRef;
import com.runframe.api.suite.SuiteContext;
import com.runframe.api.suite.TestFile;

/**
 * 只在钩子中使用 Service，定义阶段不需要其实例
 */
public class ServiceHookTests implements TestFile {

    @Override
    public void define(SuiteContext ctx) {
        ProviderRef<Object> browser = ctx.getService("browser");

        ctx.describe("browser session", () -> {
            ctx.before(() -> browser.get());

            ctx.it("opens home page", () -> {
            });
        });
    }
}
