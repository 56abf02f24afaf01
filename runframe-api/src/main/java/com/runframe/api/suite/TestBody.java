package com.runframe.api.suite;

/**
 * 测试或钩子的执行体
 */
@FunctionalInterface
public interface TestBody {

    void run() throws Exception;
}
