package com.runframe.api.suite;

import com.runframe.api.provider.ProviderRef;

/**
 * 套件定义上下文
 * <p>
 * describe / it / 钩子都作用于当前正在定义的套件，嵌套 describe 会压栈。
 * 提供者只能以引用形式获取，真正的取值发生在测试执行时。
 */
public interface SuiteContext {

    void describe(String title, SuiteBody body);

    void it(String title, TestBody body);

    void before(TestBody body);

    void after(TestBody body);

    void beforeEach(TestBody body);

    void afterEach(TestBody body);

    /**
     * 为当前套件追加标签，子套件与测试继承这些标签
     */
    void tags(String... tags);

    /**
     * 加载嵌套测试文件
     *
     * @param testFile TestFile 实现类的全限定名
     */
    void loadTestFile(String testFile);

    <T> ProviderRef<T> getService(String name);

    <T> ProviderRef<T> getPageObject(String name);
}
