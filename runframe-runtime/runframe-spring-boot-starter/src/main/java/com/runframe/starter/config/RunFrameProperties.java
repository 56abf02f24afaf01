package com.runframe.starter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RunFrame 主配置属性
 */
@Data
@ConfigurationProperties(prefix = "runframe")
public class RunFrameProperties {

    /**
     * 是否启用 RunFrame。
     */
    private boolean enabled = true;

    /**
     * 运行配置文件（YAML）路径，为空时仅使用 overrides。
     */
    private String configFile;

    /**
     * 预期数据存储版本，为空时取默认值。
     */
    private String datastoreVersion;

    /**
     * 测试文件类名列表，非空时覆盖配置文件中的 testFiles。
     */
    private List<String> testFiles = new ArrayList<>();

    /**
     * 运行配置覆盖项，支持点号键。
     * <p>
     * 示例：
     *
     * <pre>
     * runframe:
     *   overrides:
     *     "[mochaOpts.bail]": true
     *     "[suiteTags.include]": smoke
     * </pre>
     */
    private Map<String, Object> overrides = new LinkedHashMap<>();

    /**
     * 应用启动完成后是否自动执行。
     */
    private boolean autoRun = false;

    /**
     * 自动执行模式。
     */
    private Mode mode = Mode.RUN;

    /**
     * 存在失败测试时，自动执行是否抛出异常（使应用启动失败）。
     */
    private boolean failOnTestFailure = true;

    public enum Mode {
        /**
         * 执行测试
         */
        RUN,
        /**
         * 只统计测试数量
         */
        STATS
    }
}
