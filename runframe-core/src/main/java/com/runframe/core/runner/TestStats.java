package com.runframe.core.runner;

import lombok.Value;

import java.util.List;

/**
 * 测试统计：叶子测试数量与被标签过滤掉的测试完整标题
 */
@Value
public class TestStats {
    int testCount;
    List<String> testsExcludedByTag;
}
