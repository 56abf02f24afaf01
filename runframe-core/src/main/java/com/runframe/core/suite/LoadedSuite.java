package com.runframe.core.suite;

import lombok.Value;

import java.util.List;

/**
 * 加载并过滤后的套件树
 */
@Value
public class LoadedSuite {
    Suite root;
    List<String> testsExcludedByTag;
}
