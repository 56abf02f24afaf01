package com.runframe.core.suite;

import com.runframe.api.config.Config;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 套件过滤：标签包含/排除 + 标题 grep
 * <p>
 * 标签挂在套件上并向下继承。测试带有任一排除标签，
 * 或包含列表非空而测试不带任何包含标签时，被按标签排除。
 * 过滤后变空的套件会被剪除。
 */
@Slf4j
public class SuiteFilter {

    private final Set<String> include;
    private final Set<String> exclude;
    private final String grep;

    public SuiteFilter(Set<String> include, Set<String> exclude, String grep) {
        this.include = Collections.unmodifiableSet(new LinkedHashSet<>(include));
        this.exclude = Collections.unmodifiableSet(new LinkedHashSet<>(exclude));
        this.grep = grep != null && !grep.isEmpty() ? grep : null;
    }

    public static SuiteFilter from(Config config) {
        return new SuiteFilter(
                toStringSet(config.getList("suiteTags.include")),
                toStringSet(config.getList("suiteTags.exclude")),
                config.get("mochaOpts.grep", String.class));
    }

    private static Set<String> toStringSet(List<?> values) {
        Set<String> result = new LinkedHashSet<>();
        for (Object value : values) {
            result.add(String.valueOf(value));
        }
        return result;
    }

    public boolean isActive() {
        return !include.isEmpty() || !exclude.isEmpty() || grep != null;
    }

    /**
     * 原地过滤套件树
     *
     * @return 被标签过滤掉的测试完整标题
     */
    public List<String> apply(Suite root) {
        List<String> excludedByTag = new ArrayList<>();
        if (!isActive()) {
            return excludedByTag;
        }
        if (!include.isEmpty()) {
            log.info("Only running suites which are tagged with {}", include);
        }
        if (!exclude.isEmpty()) {
            log.info("Filtering out any suites that include the tags {}", exclude);
        }

        filter(root, excludedByTag);

        if (!excludedByTag.isEmpty()) {
            log.info("{} tests excluded by tag", excludedByTag.size());
        }
        return excludedByTag;
    }

    private void filter(Suite suite, List<String> excludedByTag) {
        Set<String> tags = suite.effectiveTags();
        boolean tagExcluded = isExcludedByTag(tags);

        for (Test test : new ArrayList<>(suite.getTests())) {
            if (tagExcluded) {
                suite.removeTest(test);
                excludedByTag.add(test.fullTitle());
            } else if (grep != null && !test.fullTitle().contains(grep)) {
                suite.removeTest(test);
            }
        }

        for (Suite child : new ArrayList<>(suite.getSuites())) {
            filter(child, excludedByTag);
            if (child.isEmpty()) {
                suite.removeSuite(child);
            }
        }
    }

    private boolean isExcludedByTag(Set<String> tags) {
        for (String tag : tags) {
            if (exclude.contains(tag)) {
                return true;
            }
        }
        if (include.isEmpty()) {
            return false;
        }
        for (String tag : tags) {
            if (include.contains(tag)) {
                return false;
            }
        }
        return true;
    }
}
