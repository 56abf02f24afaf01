package com.runframe.api.suite;

/**
 * describe 块的定义体
 */
@FunctionalInterface
public interface SuiteBody {

    void define() throws Exception;
}
