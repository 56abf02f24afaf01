package com.runframe.core.suite;

import com.runframe.api.suite.TestFile;
import com.runframe.core.config.ConfigLoader;
import com.runframe.core.exception.ConfigurationException;
import com.runframe.core.fixtures.DashboardTests;
import com.runframe.core.fixtures.LoginTests;
import com.runframe.core.fixtures.SearchTests;
import com.runframe.core.provider.ProviderCollection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SuiteLoader 单元测试")
public class SuiteLoaderTest {

    private final SuiteLoader loader = new SuiteLoader();
    private final ProviderCollection providers = new ProviderCollection(List.of());

    private LoadedSuite load(List<?> testFiles) {
        return load(testFiles, Map.of());
    }

    private LoadedSuite load(List<?> testFiles, Map<String, Object> extra) {
        Map<String, Object> overrides = new LinkedHashMap<>(extra);
        overrides.put("testFiles", testFiles);
        return loader.load(ConfigLoader.readConfigFile(null, overrides), providers);
    }

    private static final String LOGIN = LoginTests.class.getName();
    private static final String SEARCH = SearchTests.class.getName();
    private static final String DASHBOARD = DashboardTests.class.getName();

    @Nested
    @DisplayName("构建套件树")
    class BuildTests {

        @Test
        @DisplayName("按顺序加载测试文件并统计叶子测试")
        void shouldBuildSuiteTree() {
            LoadedSuite loaded = load(List.of(LOGIN, SEARCH));
            Suite root = loaded.getRoot();

            assertEquals(5, root.countTests());
            assertEquals(2, root.getSuites().size());
            assertEquals("login", root.getSuites().get(0).getTitle());
            assertEquals(LOGIN, root.getSuites().get(0).getFile());
            assertEquals("search paginates results", root.getSuites().get(1).getTests().get(1).fullTitle());
            assertTrue(loaded.getTestsExcludedByTag().isEmpty());
        }

        @Test
        @DisplayName("嵌套套件与 loadTestFile 引入的文件都应计入")
        void shouldSupportNestingAndNestedFiles() {
            Suite root = load(List.of(DASHBOARD)).getRoot();

            assertEquals(4, root.countTests());
            Suite dashboard = root.getSuites().get(0);
            assertEquals("dashboard widgets renders", dashboard.getSuites().get(0).getTests().get(0).fullTitle());
            assertEquals(1, dashboard.getHooks(HookType.BEFORE_EACH).size());
            assertEquals(SEARCH, root.getSuites().get(1).getFile());
        }

        @Test
        @DisplayName("覆盖项中可以直接传入 TestFile 实例")
        void shouldAcceptTestFileInstances() {
            TestFile inline = ctx -> ctx.describe("inline", () -> ctx.it("works", () -> {
            }));

            assertEquals(1, load(List.of(inline)).getRoot().countTests());
        }
    }

    @Nested
    @DisplayName("错误处理")
    class ErrorTests {

        @Test
        @DisplayName("同一文件加载两次应报配置错误")
        void duplicateFileShouldFail() {
            ConfigurationException ex = assertThrows(ConfigurationException.class,
                    () -> load(List.of(DASHBOARD, SEARCH)));

            assertEquals("Test file [" + SEARCH + "] was loaded more than once", ex.getMessage());
        }

        @Test
        @DisplayName("找不到测试文件类应报配置错误")
        void missingClassShouldFail() {
            assertThrows(ConfigurationException.class, () -> load(List.of("com.example.MissingTests")));
        }

        @Test
        @DisplayName("测试文件抛出受检异常应标明文件")
        void checkedFailureShouldNameFile() {
            TestFile broken = ctx -> {
                throw new IOException("fixture missing");
            };

            ConfigurationException ex = assertThrows(ConfigurationException.class, () -> load(List.of(broken)));
            assertTrue(ex.getMessage().contains("fixture missing"));
            assertInstanceOf(IOException.class, ex.getCause());
        }

        @Test
        @DisplayName("在 describe 之外声明标签应报错")
        void tagsOutsideDescribeShouldFail() {
            TestFile rootTags = ctx -> ctx.tags("smoke");

            assertThrows(ConfigurationException.class, () -> load(List.of(rootTags)));
        }
    }

    @Nested
    @DisplayName("过滤")
    class FilterTests {

        @Test
        @DisplayName("包含标签：未带标签的测试被排除并剪除空套件")
        void includeTagShouldExcludeOthers() {
            LoadedSuite loaded = load(List.of(LOGIN, SEARCH), Map.of("suiteTags.include", List.of("smoke")));

            assertEquals(3, loaded.getRoot().countTests());
            assertEquals(1, loaded.getRoot().getSuites().size());
            assertEquals(List.of("search finds documents", "search paginates results"),
                    loaded.getTestsExcludedByTag());
        }

        @Test
        @DisplayName("排除标签对嵌套套件继承生效")
        void excludeTagShouldBeInherited() {
            LoadedSuite loaded = load(List.of(DASHBOARD), Map.of("suiteTags.exclude", List.of("smoke")));

            assertEquals(List.of("dashboard widgets renders"), loaded.getTestsExcludedByTag());
            assertEquals(3, loaded.getRoot().countTests());
            assertTrue(loaded.getRoot().getSuites().get(0).getSuites().isEmpty());
        }

        @Test
        @DisplayName("grep 只保留标题匹配的测试且不计入标签排除")
        void grepShouldFilterByTitle() {
            LoadedSuite loaded = load(List.of(LOGIN, SEARCH), Map.of("mochaOpts.grep", "password"));

            assertEquals(1, loaded.getRoot().countTests());
            assertEquals("login rejects wrong password", loaded.getRoot().allTests().get(0).fullTitle());
            assertTrue(loaded.getTestsExcludedByTag().isEmpty());
        }
    }
}
