package com.runframe.core.suite;

import com.runframe.api.suite.TestBody;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 测试套件
 * <p>
 * 根套件标题为空，不对应任何 describe 块。
 */
public class Suite {

    private final String title;
    private final Suite parent;
    private final String file;

    private final Set<String> tags = new LinkedHashSet<>();
    private final List<Suite> suites = new ArrayList<>();
    private final List<Test> tests = new ArrayList<>();
    private final Map<HookType, List<Hook>> hooks = new EnumMap<>(HookType.class);

    public Suite(String title, Suite parent, String file) {
        this.title = title;
        this.parent = parent;
        this.file = file;
        for (HookType type : HookType.values()) {
            hooks.put(type, new ArrayList<>());
        }
    }

    public static Suite root() {
        return new Suite("", null, null);
    }

    // ==================== 构建 ====================

    public Suite addSuite(String title, String file) {
        Suite child = new Suite(title, this, file);
        suites.add(child);
        return child;
    }

    public Test addTest(String title, TestBody body) {
        Test test = new Test(title, this, body);
        tests.add(test);
        return test;
    }

    public Hook addHook(HookType type, TestBody body) {
        Hook hook = new Hook(type, this, body);
        hooks.get(type).add(hook);
        return hook;
    }

    public void addTags(Iterable<String> newTags) {
        for (String tag : newTags) {
            tags.add(tag);
        }
    }

    void removeTest(Test test) {
        tests.remove(test);
    }

    void removeSuite(Suite suite) {
        suites.remove(suite);
    }

    // ==================== 查询 ====================

    public String getTitle() {
        return title;
    }

    public Suite getParent() {
        return parent;
    }

    public String getFile() {
        return file;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public Set<String> getTags() {
        return Collections.unmodifiableSet(tags);
    }

    /**
     * 自身标签与所有祖先标签的并集
     */
    public Set<String> effectiveTags() {
        Set<String> result = new LinkedHashSet<>();
        for (Suite s = this; s != null; s = s.parent) {
            result.addAll(s.tags);
        }
        return result;
    }

    public List<Suite> getSuites() {
        return Collections.unmodifiableList(suites);
    }

    public List<Test> getTests() {
        return Collections.unmodifiableList(tests);
    }

    public List<Hook> getHooks(HookType type) {
        return Collections.unmodifiableList(hooks.get(type));
    }

    public boolean isEmpty() {
        return suites.isEmpty() && tests.isEmpty();
    }

    public String fullTitle() {
        if (parent == null) {
            return title;
        }
        String parentTitle = parent.fullTitle();
        return parentTitle.isEmpty() ? title : parentTitle + " " + title;
    }

    /**
     * 递归统计叶子测试数量
     */
    public int countTests() {
        int count = tests.size();
        for (Suite child : suites) {
            count += child.countTests();
        }
        return count;
    }

    /**
     * 深度优先列出全部测试（先本套件测试，再子套件）
     */
    public List<Test> allTests() {
        List<Test> result = new ArrayList<>(tests);
        for (Suite child : suites) {
            result.addAll(child.allTests());
        }
        return result;
    }

    @Override
    public String toString() {
        return "Suite{" + (isRoot() ? "<root>" : fullTitle()) + ", tests=" + countTests() + "}";
    }
}
