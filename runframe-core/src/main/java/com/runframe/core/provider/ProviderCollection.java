package com.runframe.core.provider;

import com.runframe.api.exception.RunFrameException;
import com.runframe.api.provider.ProviderContext;
import com.runframe.api.provider.ProviderFactory;
import com.runframe.api.provider.ProviderRef;
import com.runframe.core.exception.DuplicateProviderException;
import com.runframe.core.exception.ProviderCycleException;
import com.runframe.core.exception.ProviderResolutionException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 提供者集合（运行级依赖注入容器）
 * <p>
 * 职责：
 * 1. 构造时校验同类别内名称唯一
 * 2. 首次引用时惰性实例化，结果按 (类别, 名称) 缓存为单例
 * 3. 缓存的是解析中的 Future 而非最终值，并发请求共享同一次工厂调用
 * 4. 记录提供者之间的依赖边，等待一个未完成且依赖链回到自身的提供者即判定为循环（同步与异步部分均适用）
 */
@Slf4j
public class ProviderCollection {

    private final List<ProviderSpec> specs;
    private final Map<ProviderKey, ProviderSpec> index = new LinkedHashMap<>();

    // 已解析或解析中的实例
    private final Map<ProviderKey, CompletableFuture<Object>> instances = new ConcurrentHashMap<>();

    // 提供者之间已发生的依赖查找：请求方 -> 被请求方
    private final Map<ProviderKey, Set<ProviderKey>> dependencies = new HashMap<>();

    private final ReentrantLock resolveLock = new ReentrantLock();
    private final ProviderContext context = new CollectionContext(null);

    public ProviderCollection(List<ProviderSpec> specs) {
        this.specs = Collections.unmodifiableList(new ArrayList<>(specs));
        for (ProviderSpec spec : this.specs) {
            if (index.putIfAbsent(spec.getKey(), spec) != null) {
                throw new DuplicateProviderException(spec.getKind(), spec.getName());
            }
        }
        log.debug("Provider collection created with {} providers", this.specs.size());
    }

    // ==================== 查询 ====================

    /**
     * 是否注册了该名称的 Service，不会触发实例化
     */
    public boolean hasService(String name) {
        return index.containsKey(ProviderKey.service(name));
    }

    public boolean hasPageObject(String name) {
        return index.containsKey(ProviderKey.pageObject(name));
    }

    public ProviderContext getContext() {
        return context;
    }

    // ==================== 加载 ====================

    /**
     * 按注册顺序解析全部提供者，遇到第一个错误立即失败
     */
    public void loadAll() {
        log.debug("Loading {} providers", specs.size());
        for (ProviderSpec spec : specs) {
            ProviderKey key = spec.getKey();
            await(key, resolve(key));
        }
        log.debug("All {} providers loaded", specs.size());
    }

    /**
     * 以提供者的依赖注入上下文调用任意工厂
     * <p>
     * 异步结果会被等待；运行时异常原样抛出。
     */
    public Object invokeProviderFn(ProviderFactory fn) {
        Object result;
        try {
            result = fn.create(context);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RunFrameException("Provider function failed: " + e.getMessage(), e);
        }

        if (result instanceof CompletionStage) {
            try {
                return ((CompletionStage<?>) result).toCompletableFuture().join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new RunFrameException("Provider function failed: " + cause.getMessage(), cause);
            }
        }
        return result;
    }

    // ==================== 解析 ====================

    CompletableFuture<Object> resolve(ProviderKey key) {
        return resolve(null, key);
    }

    /**
     * @param requester 发起查找的提供者，顶层查找（loadAll、测试文件、invokeProviderFn）为 null
     */
    private CompletableFuture<Object> resolve(ProviderKey requester, ProviderKey key) {
        ProviderSpec spec;
        CompletableFuture<Object> created = new CompletableFuture<>();
        resolveLock.lock();
        try {
            CompletableFuture<Object> existing = instances.get(key);
            if (existing != null) {
                if (requester != null) {
                    checkCycle(requester, key);
                    addEdge(requester, key);
                }
                return existing;
            }

            spec = index.get(key);
            if (spec == null) {
                throw new ProviderResolutionException(key.getKind(), key.getName(),
                        "Unknown " + key.getKind() + " [" + key.getName() + "]");
            }
            if (requester != null) {
                addEdge(requester, key);
            }
            instances.put(key, created);
        } finally {
            resolveLock.unlock();
        }

        // 工厂在锁外执行，其异步部分可以在任意线程继续查找依赖
        CompletableFuture<Object> result = invoke(spec);
        if (result instanceof NeverCompletingFuture) {
            resolveLock.lock();
            try {
                instances.put(key, result);
            } finally {
                resolveLock.unlock();
            }
            return result;
        }

        result.whenComplete((value, error) -> {
            if (error != null) {
                created.completeExceptionally(unwrap(error));
            } else {
                created.complete(value);
            }
        });
        return created;
    }

    private CompletableFuture<Object> invoke(ProviderSpec spec) {
        ProviderKey key = spec.getKey();
        log.debug("[{}] Initializing provider", key);

        Object result;
        try {
            result = spec.getFactory().create(new CollectionContext(key));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(initFailure(key, e));
        }

        if (result instanceof NeverCompletingFuture) {
            @SuppressWarnings("unchecked")
            NeverCompletingFuture<Object> pending = (NeverCompletingFuture<Object>) result;
            return pending;
        }

        if (result instanceof CompletionStage) {
            return ((CompletionStage<?>) result).toCompletableFuture()
                    .<Object>handle((value, error) -> {
                        if (error != null) {
                            throw initFailure(key, unwrap(error));
                        }
                        return value;
                    });
        }

        return CompletableFuture.completedFuture(result);
    }

    private Object await(ProviderKey key, CompletableFuture<Object> future) {
        if (future instanceof NeverCompletingFuture) {
            throw new ProviderResolutionException(key.getKind(), key.getName(),
                    key.getKind() + " [" + key.getName() + "] is disabled during test analysis and never resolves");
        }
        try {
            return future.join();
        } catch (CompletionException e) {
            throw initFailure(key, unwrap(e));
        }
    }

    private void addEdge(ProviderKey from, ProviderKey to) {
        dependencies.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
    }

    /**
     * requester 依赖一个尚未完成的提供者时，若该提供者沿未完成的依赖链能回到 requester，则构成循环
     */
    private void checkCycle(ProviderKey requester, ProviderKey target) {
        List<ProviderKey> path = new ArrayList<>();
        if (findPath(target, requester, path, new HashSet<>())) {
            List<String> cycle = new ArrayList<>();
            for (ProviderKey step : path) {
                cycle.add(step.toString());
            }
            cycle.add(target.toString());
            throw new ProviderCycleException(target.getKind(), target.getName(), cycle);
        }
    }

    private boolean findPath(ProviderKey from, ProviderKey to, List<ProviderKey> path, Set<ProviderKey> visited) {
        CompletableFuture<Object> future = instances.get(from);
        if (future == null || future.isDone() || !visited.add(from)) {
            return false;
        }
        path.add(from);
        if (from.equals(to)) {
            return true;
        }
        for (ProviderKey next : dependencies.getOrDefault(from, Collections.emptySet())) {
            if (findPath(next, to, path, visited)) {
                return true;
            }
        }
        path.remove(path.size() - 1);
        return false;
    }

    private static ProviderResolutionException initFailure(ProviderKey key, Throwable error) {
        if (error instanceof ProviderResolutionException) {
            return (ProviderResolutionException) error;
        }
        return new ProviderResolutionException(key.getKind(), key.getName(),
                "Failed to initialize " + key.getKind() + " [" + key.getName() + "]: " + error.getMessage(), error);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    // ==================== 注入上下文 ====================

    private class CollectionContext implements ProviderContext {

        private final ProviderKey requester;

        CollectionContext(ProviderKey requester) {
            this.requester = requester;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <T> T getService(String name) {
            ProviderKey key = ProviderKey.service(name);
            return (T) await(key, resolve(requester, key));
        }

        @Override
        @SuppressWarnings("unchecked")
        public <T> T getPageObject(String name) {
            ProviderKey key = ProviderKey.pageObject(name);
            return (T) await(key, resolve(requester, key));
        }

        @Override
        public <T> ProviderRef<T> serviceRef(String name) {
            ProviderKey key = ProviderKey.service(name);
            return new DefaultProviderRef<>(key, resolve(requester, key));
        }

        @Override
        public <T> ProviderRef<T> pageObjectRef(String name) {
            ProviderKey key = ProviderKey.pageObject(name);
            return new DefaultProviderRef<>(key, resolve(requester, key));
        }

        @Override
        public boolean hasService(String name) {
            return ProviderCollection.this.hasService(name);
        }

        @Override
        public boolean hasPageObject(String name) {
            return ProviderCollection.this.hasPageObject(name);
        }
    }
}
