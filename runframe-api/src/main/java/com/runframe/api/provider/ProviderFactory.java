package com.runframe.api.provider;

/**
 * 提供者工厂
 * <p>
 * 返回值即提供者实例；若返回 {@link java.util.concurrent.CompletionStage}，
 * 则视为异步提供者，其完成值才是真正的实例。
 * 实现类若通过配置中的类名声明，必须提供公共无参构造器。
 */
@FunctionalInterface
public interface ProviderFactory {

    /**
     * 创建提供者实例
     *
     * @param context 依赖注入上下文，可按名称获取其他提供者
     * @return 实例，或一个最终产出实例的 CompletionStage
     */
    Object create(ProviderContext context) throws Exception;
}
