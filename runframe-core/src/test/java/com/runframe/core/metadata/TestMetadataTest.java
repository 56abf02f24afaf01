package com.runframe.core.metadata;

import com.runframe.api.exception.RunFrameException;
import com.runframe.core.lifecycle.Lifecycle;
import com.runframe.core.suite.Suite;
import com.runframe.core.suite.TestRunnable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TestMetadata 单元测试")
public class TestMetadataTest {

    private Lifecycle lifecycle;
    private TestMetadata metadata;

    @BeforeEach
    void setUp() {
        lifecycle = new Lifecycle();
        metadata = new TestMetadata(lifecycle);
    }

    @Test
    @DisplayName("没有执行中的节点时追加元数据应失败")
    void addWithoutRunnableShouldFail() {
        assertNull(metadata.getCurrentRunnable());
        assertThrows(RunFrameException.class, () -> metadata.add("screenshot", "a.png"));
    }

    @Test
    @DisplayName("元数据追加到 beforeEachRunnable 通知的当前节点")
    void addShouldTargetCurrentRunnable() {
        Suite suite = Suite.root().addSuite("visualize", "VisualizeTests");
        TestRunnable first = suite.addTest("first", () -> {
        });
        TestRunnable second = suite.addTest("second", () -> {
        });

        lifecycle.getBeforeEachRunnable().trigger(first);
        metadata.add("screenshot", "first.png");
        lifecycle.getBeforeEachRunnable().trigger(second);
        metadata.add("requestId", 42);

        assertSame(second, metadata.getCurrentRunnable());
        assertEquals(Map.of("screenshot", "first.png"), metadata.getMetadata(first));
        assertEquals(Map.of("requestId", 42), second.getMetadata());
    }
}
