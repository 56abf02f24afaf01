package com.runframe.core.suite;

import com.runframe.api.exception.RunFrameException;
import com.runframe.api.provider.ProviderContext;
import com.runframe.api.provider.ProviderRef;
import com.runframe.api.suite.SuiteBody;
import com.runframe.api.suite.SuiteContext;
import com.runframe.api.suite.TestBody;
import com.runframe.api.suite.TestFile;
import com.runframe.core.exception.ConfigurationException;
import com.runframe.core.util.ClassInstantiator;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * 套件定义上下文的默认实现
 * <p>
 * 以栈维护当前套件：describe 压栈、定义体结束出栈。
 */
class DefaultSuiteContext implements SuiteContext {

    private final ProviderContext providers;
    private final Deque<Suite> stack = new ArrayDeque<>();

    // 已加载的测试文件：类名字符串或 TestFile 实例本身
    private final Set<Object> loadedFiles = new HashSet<>();

    private String currentFile;
    private int fileCount;

    DefaultSuiteContext(Suite root, ProviderContext providers) {
        this.providers = providers;
        this.stack.push(root);
    }

    int getFileCount() {
        return fileCount;
    }

    // ==================== 测试文件 ====================

    @Override
    public void loadTestFile(String testFile) {
        loadTestFile((Object) testFile);
    }

    void loadTestFile(Object entry) {
        String name;
        TestFile testFile;
        if (entry instanceof String) {
            name = ((String) entry).trim();
            markLoaded(name, name);
            testFile = ClassInstantiator.instantiate("test file [" + name + "]", name, TestFile.class);
        } else if (entry instanceof Class) {
            name = ((Class<?>) entry).getName();
            markLoaded(name, name);
            testFile = ClassInstantiator.instantiate("test file [" + name + "]", (Class<?>) entry, TestFile.class);
        } else if (entry instanceof TestFile) {
            name = entry.getClass().getName();
            markLoaded(entry, name);
            testFile = (TestFile) entry;
        } else {
            throw new ConfigurationException("testFiles", "Expected a TestFile class name, got "
                    + (entry == null ? "null" : entry.getClass().getSimpleName()));
        }

        String previousFile = currentFile;
        currentFile = name;
        fileCount++;
        try {
            testFile.define(this);
        } catch (RunFrameException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigurationException("testFiles",
                    "Failed to load test file [" + name + "]: " + e.getMessage(), e);
        } finally {
            currentFile = previousFile;
        }
    }

    private void markLoaded(Object identity, String name) {
        if (!loadedFiles.add(identity)) {
            throw new ConfigurationException("testFiles", "Test file [" + name + "] was loaded more than once");
        }
    }

    // ==================== 定义 ====================

    @Override
    public void describe(String title, SuiteBody body) {
        Suite child = current().addSuite(title, currentFile);
        stack.push(child);
        try {
            body.define();
        } catch (RunFrameException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigurationException("testFiles",
                    "Failed to define suite [" + child.fullTitle() + "]: " + e.getMessage(), e);
        } finally {
            stack.pop();
        }
    }

    @Override
    public void it(String title, TestBody body) {
        current().addTest(title, body);
    }

    @Override
    public void before(TestBody body) {
        current().addHook(HookType.BEFORE_ALL, body);
    }

    @Override
    public void after(TestBody body) {
        current().addHook(HookType.AFTER_ALL, body);
    }

    @Override
    public void beforeEach(TestBody body) {
        current().addHook(HookType.BEFORE_EACH, body);
    }

    @Override
    public void afterEach(TestBody body) {
        current().addHook(HookType.AFTER_EACH, body);
    }

    @Override
    public void tags(String... tags) {
        Suite suite = current();
        if (suite.isRoot()) {
            throw new ConfigurationException("testFiles", "tags() must be called inside a describe block");
        }
        suite.addTags(Arrays.asList(tags));
    }

    // ==================== 提供者 ====================

    @Override
    public <T> ProviderRef<T> getService(String name) {
        return providers.serviceRef(name);
    }

    @Override
    public <T> ProviderRef<T> getPageObject(String name) {
        return providers.pageObjectRef(name);
    }

    private Suite current() {
        return stack.peek();
    }
}
