package com.runframe.core.lifecycle;

import com.runframe.core.exception.LifecyclePhaseException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * 生命周期阶段
 * <p>
 * 一个具名广播点：处理器按注册顺序依次执行（不并发），
 * 第一个失败的处理器会中止本阶段剩余处理器，并以 {@link LifecyclePhaseException} 向上抛出。
 * 已执行的处理器不会回滚。
 * <p>
 * 单次阶段（singular）只允许触发一次；同一阶段在触发过程中被再次触发视为错误。
 *
 * @param <A> 触发参数类型
 */
@Slf4j
public class LifecyclePhase<A> {

    private final String name;
    private final boolean singular;

    private final List<PhaseHandler<A>> handlers = new CopyOnWriteArrayList<>();
    private final List<Runnable> startListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> completeListeners = new CopyOnWriteArrayList<>();

    private final AtomicBoolean triggering = new AtomicBoolean(false);
    private final AtomicBoolean triggered = new AtomicBoolean(false);

    public LifecyclePhase(String name) {
        this(name, false);
    }

    public LifecyclePhase(String name, boolean singular) {
        this.name = name;
        this.singular = singular;
    }

    public String getName() {
        return name;
    }

    public boolean isSingular() {
        return singular;
    }

    /**
     * 是否已被触发过（无论成功与否）
     */
    public boolean isTriggered() {
        return triggered.get();
    }

    public int getHandlerCount() {
        return handlers.size();
    }

    // ==================== 订阅 ====================

    /**
     * 注册同步处理器
     */
    public void add(PhaseHandler<A> handler) {
        handlers.add(handler);
    }

    /**
     * 注册异步处理器，下一个处理器会等待其返回的 CompletionStage 完成
     */
    public void addAsync(Function<? super A, ? extends CompletionStage<?>> handler) {
        add(arg -> {
            try {
                handler.apply(arg).toCompletableFuture().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception) {
                    throw (Exception) cause;
                }
                throw e;
            }
        });
    }

    /**
     * 阶段开始信号
     */
    public void onStart(Runnable listener) {
        startListeners.add(listener);
    }

    /**
     * 阶段完成信号，仅在全部处理器成功后发出
     */
    public void onComplete(Runnable listener) {
        completeListeners.add(listener);
    }

    // ==================== 触发 ====================

    public void trigger() {
        trigger(null);
    }

    public void trigger(A arg) {
        if (!triggering.compareAndSet(false, true)) {
            throw new LifecyclePhaseException(name,
                    "lifecycle phase [" + name + "] triggered while already running");
        }

        try {
            if (singular && !triggered.compareAndSet(false, true)) {
                throw new LifecyclePhaseException(name,
                        "singular lifecycle phase [" + name + "] can only be triggered once");
            }
            triggered.set(true);

            startListeners.forEach(Runnable::run);

            for (PhaseHandler<A> handler : handlers) {
                try {
                    handler.handle(arg);
                } catch (Exception | AssertionError e) {
                    log.warn("[{}] Lifecycle handler failed, skipping remaining handlers: {}", name, e.getMessage());
                    throw new LifecyclePhaseException(name,
                            "lifecycle phase [" + name + "] failed: " + e.getMessage(), e);
                }
            }

            completeListeners.forEach(Runnable::run);
        } finally {
            triggering.set(false);
        }
    }

    @Override
    public String toString() {
        return "LifecyclePhase{" + name + (singular ? ", singular" : "") + "}";
    }
}
