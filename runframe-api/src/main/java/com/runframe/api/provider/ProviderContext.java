package com.runframe.api.provider;

/**
 * 依赖注入上下文
 * <p>
 * 工厂在创建期间通过阻塞式的 {@code getService} / {@code getPageObject} 获取依赖；
 * 测试文件在定义阶段应使用不阻塞的 {@code serviceRef} / {@code pageObjectRef}。
 */
public interface ProviderContext {

    /**
     * 获取 Service 实例，必要时触发解析并等待异步结果
     */
    <T> T getService(String name);

    /**
     * 获取 PageObject 实例，必要时触发解析并等待异步结果
     */
    <T> T getPageObject(String name);

    /**
     * 获取 Service 引用，不等待结果
     */
    <T> ProviderRef<T> serviceRef(String name);

    /**
     * 获取 PageObject 引用，不等待结果
     */
    <T> ProviderRef<T> pageObjectRef(String name);

    boolean hasService(String name);

    boolean hasPageObject(String name);
}
