package com.runframe.core.lifecycle;

import com.runframe.api.exception.InvalidArgumentException;
import com.runframe.core.suite.Suite;
import com.runframe.core.suite.Test;
import com.runframe.core.suite.TestRunnable;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 运行级生命周期
 * <p>
 * 阶段集合在构造时固定，每个运行器独占一个实例，不跨运行复用。
 * 既可通过 getter 类型安全地访问，也可通过 {@link #phases()} 按名称显式遍历。
 */
@Getter
public class Lifecycle {

    private final LifecyclePhase<Suite> beforeTests = new LifecyclePhase<>("beforeTests", true);
    private final LifecyclePhase<TestRunnable> beforeEachRunnable = new LifecyclePhase<>("beforeEachRunnable");
    private final LifecyclePhase<Suite> beforeTestSuite = new LifecyclePhase<>("beforeTestSuite");
    private final LifecyclePhase<Test> beforeEachTest = new LifecyclePhase<>("beforeEachTest");
    private final LifecyclePhase<Suite> afterTestSuite = new LifecyclePhase<>("afterTestSuite");
    private final LifecyclePhase<RunnableFailure> testFailure = new LifecyclePhase<>("testFailure");
    private final LifecyclePhase<RunnableFailure> testHookFailure = new LifecyclePhase<>("testHookFailure");
    private final LifecyclePhase<Void> cleanup = new LifecyclePhase<>("cleanup", true);

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, LifecyclePhase<?>> phases;

    public Lifecycle() {
        Map<String, LifecyclePhase<?>> registry = new LinkedHashMap<>();
        register(registry, beforeTests);
        register(registry, beforeEachRunnable);
        register(registry, beforeTestSuite);
        register(registry, beforeEachTest);
        register(registry, afterTestSuite);
        register(registry, testFailure);
        register(registry, testHookFailure);
        register(registry, cleanup);
        this.phases = Collections.unmodifiableMap(registry);
    }

    private static void register(Map<String, LifecyclePhase<?>> registry, LifecyclePhase<?> phase) {
        registry.put(phase.getName(), phase);
    }

    /**
     * 所有阶段（按声明顺序，只读）
     */
    public Map<String, LifecyclePhase<?>> phases() {
        return phases;
    }

    /**
     * 按名称获取阶段
     *
     * @throws InvalidArgumentException 名称不在固定阶段集合中
     */
    @SuppressWarnings("unchecked")
    public <A> LifecyclePhase<A> phase(String name) {
        LifecyclePhase<?> phase = phases.get(name);
        if (phase == null) {
            throw new InvalidArgumentException("phaseName", name, "Unknown lifecycle phase [" + name + "]");
        }
        return (LifecyclePhase<A>) phase;
    }
}
