package com.runframe.core.util;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * YAML 工具类
 * <p>
 * 运行配置只允许普通的映射、列表与标量：
 * 使用 SafeConstructor 拒绝 !! 全局类型标签，并禁止重复键，
 * 避免同名提供者在 YAML 层面被静默覆盖。
 */
public final class YamlUtils {

    private static final int MAX_ALIASES = 50;

    private YamlUtils() {
    }

    public static Yaml createConfigYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        loaderOptions.setMaxAliasesForCollections(MAX_ALIASES);
        return new Yaml(new SafeConstructor(loaderOptions));
    }
}
