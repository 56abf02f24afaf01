package com.runframe.api.provider;

/**
 * 提供者引用
 * <p>
 * 在定义阶段持有，在测试或钩子执行时通过 {@link #get()} 取值。
 */
public interface ProviderRef<T> {

    String getName();

    ProviderKind getKind();

    /**
     * 实例是否已就绪（成功完成）
     */
    boolean isResolved();

    /**
     * 获取实例，异步提供者未完成时会等待
     */
    T get();
}
