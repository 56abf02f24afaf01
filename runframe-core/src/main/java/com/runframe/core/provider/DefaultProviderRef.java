package com.runframe.core.provider;

import com.runframe.api.provider.ProviderKind;
import com.runframe.api.provider.ProviderRef;
import com.runframe.core.exception.ProviderResolutionException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 基于解析 Future 的提供者引用
 */
class DefaultProviderRef<T> implements ProviderRef<T> {

    private final ProviderKey key;
    private final CompletableFuture<Object> future;

    DefaultProviderRef(ProviderKey key, CompletableFuture<Object> future) {
        this.key = key;
        this.future = future;
    }

    @Override
    public String getName() {
        return key.getName();
    }

    @Override
    public ProviderKind getKind() {
        return key.getKind();
    }

    @Override
    public boolean isResolved() {
        return future.isDone() && !future.isCompletedExceptionally();
    }

    @Override
    @SuppressWarnings("unchecked")
    public T get() {
        if (future instanceof NeverCompletingFuture) {
            throw new ProviderResolutionException(key.getKind(), key.getName(),
                    key.getKind() + " [" + key.getName() + "] is disabled during test analysis and never resolves");
        }
        try {
            return (T) future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    @Override
    public String toString() {
        return "ProviderRef{" + key + ", resolved=" + isResolved() + "}";
    }
}
