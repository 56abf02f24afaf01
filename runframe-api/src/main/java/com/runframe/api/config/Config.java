package com.runframe.api.config;

import java.util.List;

/**
 * 运行配置访问器
 * <p>
 * 路径使用点号分隔，例如 {@code mochaOpts.dryRun}。
 * 未知路径视为配置错误。
 */
public interface Config {

    /**
     * 获取配置值
     *
     * @param path 点号分隔的路径
     * @return 配置值，可能为 null（已声明但值为空）
     */
    Object get(String path);

    /**
     * 获取配置值并校验类型
     */
    <T> T get(String path, Class<T> type);

    /**
     * 获取配置值，路径不存在时返回默认值
     */
    Object getOrDefault(String path, Object defaultValue);

    boolean has(String path);

    /**
     * 获取列表，值为空时返回空列表
     */
    List<?> getList(String path);

    boolean getBoolean(String path);
}
