package com.runframe.core.provider;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * 永不完成的 Future
 * <p>
 * 测试分析模式下用来替换被禁用的提供者：依赖它的代码只能注册回调，永远观察不到结果。
 * 所有完成、取消与强制赋值的入口都被屏蔽。
 * 每次使用都应新建实例，挂在其上的回调会随实例一起被回收。
 */
public final class NeverCompletingFuture<T> extends CompletableFuture<T> {

    public static <T> NeverCompletingFuture<T> create() {
        return new NeverCompletingFuture<>();
    }

    @Override
    public boolean complete(T value) {
        return false;
    }

    @Override
    public boolean completeExceptionally(Throwable ex) {
        return false;
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        return false;
    }

    @Override
    public CompletableFuture<T> completeAsync(Supplier<? extends T> supplier, Executor executor) {
        return this;
    }

    @Override
    public CompletableFuture<T> completeAsync(Supplier<? extends T> supplier) {
        return this;
    }

    @Override
    public void obtrudeValue(T value) {
        throw new UnsupportedOperationException("NeverCompletingFuture cannot be completed");
    }

    @Override
    public void obtrudeException(Throwable ex) {
        throw new UnsupportedOperationException("NeverCompletingFuture cannot be completed");
    }

    @Override
    public String toString() {
        return "NeverCompletingFuture";
    }
}
