package com.runframe.core.spi;

import com.runframe.api.config.Config;
import com.runframe.core.config.ConfigLoader;
import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 测试运行选项
 */
@Getter
@Builder
public class TestRunOptions {

    /**
     * 只输出套件结构，不执行
     */
    @Builder.Default
    private boolean dryRun = false;

    /**
     * 干跑报告输出位置
     */
    @Builder.Default
    private Path dryRunOutput = Paths.get(ConfigLoader.DEFAULT_DRY_RUN_OUTPUT);

    /**
     * 首个失败后停止
     */
    @Builder.Default
    private boolean bail = false;

    public static TestRunOptions defaults() {
        return TestRunOptions.builder().build();
    }

    public static TestRunOptions from(Config config) {
        return TestRunOptions.builder()
                .dryRun(config.getBoolean("mochaOpts.dryRun"))
                .dryRunOutput(Paths.get(config.get("mochaOpts.dryRunOutput", String.class)).toAbsolutePath())
                .bail(config.getBoolean("mochaOpts.bail"))
                .build();
    }

    @Override
    public String toString() {
        return String.format("TestRunOptions{dryRun=%s, output=%s, bail=%s}", dryRun, dryRunOutput, bail);
    }
}
