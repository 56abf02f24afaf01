package com.runframe.core.metadata;

import com.runframe.api.exception.RunFrameException;
import com.runframe.core.lifecycle.Lifecycle;
import com.runframe.core.suite.TestRunnable;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 测试元数据
 * <p>
 * 通过 beforeEachRunnable 阶段跟踪当前执行节点，
 * 测试代码与服务可以向当前节点追加元数据（截图路径、请求 ID 等），供报告使用。
 */
@Slf4j
public class TestMetadata {

    private final AtomicReference<TestRunnable> currentRunnable = new AtomicReference<>();

    public TestMetadata(Lifecycle lifecycle) {
        lifecycle.getBeforeEachRunnable().add(currentRunnable::set);
    }

    /**
     * 向当前执行节点追加元数据
     *
     * @throws RunFrameException 当前没有正在执行的节点
     */
    public void add(String key, Object value) {
        TestRunnable runnable = currentRunnable.get();
        if (runnable == null) {
            throw new RunFrameException("Unable to add test metadata [" + key + "]: no test or hook is running");
        }
        runnable.putMetadata(key, value);
        log.debug("[{}] Added metadata {}", runnable.fullTitle(), key);
    }

    public TestRunnable getCurrentRunnable() {
        return currentRunnable.get();
    }

    public Map<String, Object> getMetadata(TestRunnable runnable) {
        return runnable.getMetadata();
    }
}
