package com.runframe.core.spi;

import com.runframe.core.lifecycle.Lifecycle;
import com.runframe.core.suite.Suite;

/**
 * 测试运行时 SPI
 * <p>
 * 接收已构建并过滤好的套件树，执行并返回失败数；
 * 干跑模式下只输出套件结构报告，不执行任何测试。
 */
public interface TestRuntime {

    /**
     * @param root      根套件
     * @param lifecycle 运行级生命周期，运行时在各执行节点触发对应阶段
     * @param options   运行选项
     * @return 失败数
     */
    int run(Suite root, Lifecycle lifecycle, TestRunOptions options);
}
