package com.runframe.core.config;

import com.runframe.core.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MapConfig 单元测试")
public class MapConfigTest {

    @Test
    @DisplayName("按点号路径读取嵌套值")
    void shouldReadDottedPaths() {
        MapConfig config = new MapConfig(Map.of("mochaOpts", Map.of("grep", "login")));

        assertEquals("login", config.get("mochaOpts.grep"));
        assertEquals("login", config.get("mochaOpts.grep", String.class));
        assertTrue(config.has("mochaOpts"));
        assertFalse(config.has("mochaOpts.bail"));
        assertEquals("fallback", config.getOrDefault("mochaOpts.bail", "fallback"));
    }

    @Test
    @DisplayName("未知键应抛出配置错误")
    void unknownKeyShouldFail() {
        MapConfig config = new MapConfig(Map.of("a", 1));

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> config.get("a.b"));
        assertEquals("Unknown config key [a.b]", ex.getMessage());
    }

    @Test
    @DisplayName("构造后与源数据隔离且不可修改")
    void shouldBeDeepFrozen() {
        List<Object> files = new ArrayList<>(List.of("a"));
        Map<String, Object> source = new HashMap<>();
        source.put("testFiles", files);
        MapConfig config = new MapConfig(source);

        files.add("b");

        assertEquals(List.of("a"), config.getList("testFiles"));
        assertThrows(UnsupportedOperationException.class, () -> config.toMap().put("x", 1));
    }

    @Test
    @DisplayName("null 值的列表读取为空列表")
    void nullListShouldBeEmpty() {
        Map<String, Object> source = new HashMap<>();
        source.put("testFiles", null);

        assertTrue(new MapConfig(source).getList("testFiles").isEmpty());
        assertFalse(new MapConfig(source).getBoolean("testFiles"));
    }
}
