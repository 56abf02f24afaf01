package com.runframe.core.lifecycle;

import com.runframe.core.suite.TestRunnable;
import lombok.Value;

/**
 * 测试或钩子失败事件的载荷
 */
@Value
public class RunnableFailure {
    Throwable error;
    TestRunnable runnable;
}
