package com.runframe.core.config;

import com.runframe.api.config.Config;
import com.runframe.core.exception.ConfigurationException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfigLoader 单元测试")
public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private Path fixture() throws Exception {
        return Paths.get(getClass().getResource("/config/functional.yml").toURI());
    }

    @Nested
    @DisplayName("读取与默认值")
    class ReadTests {

        @Test
        @DisplayName("读取 YAML 并补齐默认值")
        void shouldReadYamlAndApplyDefaults() throws Exception {
            Config config = ConfigLoader.readConfigFile(fixture(), null);

            assertEquals(List.of("com.runframe.core.fixtures.LoginTests"), config.getList("testFiles"));
            assertTrue(config.getBoolean("mochaOpts.bail"));
            assertFalse(config.getBoolean("mochaOpts.dryRun"));
            assertEquals(ConfigLoader.DEFAULT_DRY_RUN_OUTPUT, config.get("mochaOpts.dryRunOutput"));
            assertEquals(List.of("smoke"), config.getList("suiteTags.include"));
            assertTrue(config.getList("suiteTags.exclude").isEmpty());
            assertTrue(config.has("testRunner"));
            assertNull(config.get("testRunner"));
            assertEquals(5000, config.get("dockerServers.registry.port"));
        }

        @Test
        @DisplayName("没有配置文件时只使用覆盖项")
        void shouldAllowOverridesOnly() {
            Config config = ConfigLoader.readConfigFile(null, Map.of("testFiles", List.of("a.Test")));

            assertEquals(List.of("a.Test"), config.getList("testFiles"));
            assertTrue(config.getList("servicesRequiredForTestAnalysis").isEmpty());
            assertEquals(Map.of(), config.get("services"));
        }

        @Test
        @DisplayName("空文件视为空配置")
        void emptyFileShouldYieldDefaults() throws Exception {
            Path file = Files.writeString(tempDir.resolve("empty.yml"), "");

            Config config = ConfigLoader.readConfigFile(file, null);

            assertTrue(config.getList("testFiles").isEmpty());
        }
    }

    @Nested
    @DisplayName("覆盖项合并")
    class OverrideTests {

        @Test
        @DisplayName("覆盖项深度合并且优先于文件，支持点号键")
        void overridesShouldDeepMerge() throws Exception {
            Config config = ConfigLoader.readConfigFile(fixture(), Map.of(
                    "mochaOpts.dryRun", true,
                    "suiteTags", Map.of("exclude", List.of("slow"))));

            assertTrue(config.getBoolean("mochaOpts.dryRun"));
            assertTrue(config.getBoolean("mochaOpts.bail"));
            assertEquals(List.of("smoke"), config.getList("suiteTags.include"));
            assertEquals(List.of("slow"), config.getList("suiteTags.exclude"));
        }

        @Test
        @DisplayName("点号键应展开为嵌套结构")
        void dottedKeysShouldExpand() {
            Map<String, Object> expanded = ConfigLoader.expandDottedKeys(Map.of("a.b.c", 1));

            assertEquals(Map.of("a", Map.of("b", Map.of("c", 1))), expanded);
        }
    }

    @Nested
    @DisplayName("错误处理")
    class ErrorTests {

        @Test
        @DisplayName("文件不存在应报配置错误")
        void missingFileShouldFail() {
            Path missing = tempDir.resolve("missing.yml");

            ConfigurationException ex = assertThrows(ConfigurationException.class,
                    () -> ConfigLoader.readConfigFile(missing, null));
            assertTrue(ex.getMessage().contains("does not exist"));
        }

        @Test
        @DisplayName("根节点不是映射应报配置错误")
        void nonMappingRootShouldFail() throws Exception {
            Path file = Files.writeString(tempDir.resolve("list.yml"), "- a\n- b\n");

            assertThrows(ConfigurationException.class, () -> ConfigLoader.readConfigFile(file, null));
        }

        @Test
        @DisplayName("重复键应报配置错误")
        void duplicateKeysShouldFail() throws Exception {
            Path file = Files.writeString(tempDir.resolve("dup.yml"), "testFiles: []\ntestFiles: []\n");

            ConfigurationException ex = assertThrows(ConfigurationException.class,
                    () -> ConfigLoader.readConfigFile(file, null));
            assertTrue(ex.getMessage().startsWith("Invalid YAML"));
        }

        @Test
        @DisplayName("类型错误应标明配置键")
        void wrongTypeShouldNameKey() {
            ConfigurationException ex = assertThrows(ConfigurationException.class,
                    () -> ConfigLoader.readConfigFile(null, Map.of("mochaOpts.bail", "yes")));

            assertEquals("mochaOpts.bail", ex.getKey());
            assertEquals("Expected config key [mochaOpts.bail] to be a Boolean, got String", ex.getMessage());
        }

        @Test
        @DisplayName("标签列表只能包含字符串")
        void tagListsShouldContainStrings() {
            assertThrows(ConfigurationException.class,
                    () -> ConfigLoader.readConfigFile(null, Map.of("suiteTags.include", List.of(1, 2))));
        }
    }
}
