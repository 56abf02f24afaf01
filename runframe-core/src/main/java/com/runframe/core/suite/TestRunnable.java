package com.runframe.core.suite;

import com.runframe.api.suite.TestBody;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 可执行节点（测试或钩子）的公共部分
 */
public abstract class TestRunnable {

    private final String title;
    private final Suite parent;
    private final TestBody body;

    // 运行期间累积的元数据
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    protected TestRunnable(String title, Suite parent, TestBody body) {
        this.title = title;
        this.parent = parent;
        this.body = body;
    }

    public String getTitle() {
        return title;
    }

    public Suite getParent() {
        return parent;
    }

    public TestBody getBody() {
        return body;
    }

    /**
     * 定义该节点的测试文件
     */
    public String getFile() {
        return parent != null ? parent.getFile() : null;
    }

    public String fullTitle() {
        String parentTitle = parent != null ? parent.fullTitle() : "";
        return parentTitle.isEmpty() ? title : parentTitle + " " + title;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + fullTitle() + "}";
    }
}
