package com.runframe.api.suite;

/**
 * 测试文件
 * <p>
 * 配置项 {@code testFiles} 中的每一项都是该接口实现类的全限定名，
 * 实现类必须提供公共无参构造器。
 * {@link #define} 只负责声明套件结构，不得执行测试逻辑。
 */
@FunctionalInterface
public interface TestFile {

    void define(SuiteContext context) throws Exception;
}
