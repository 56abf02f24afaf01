package com.runframe.core.config;

import com.runframe.api.config.Config;
import com.runframe.core.exception.ConfigurationException;
import com.runframe.core.util.YamlUtils;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 运行配置加载器
 * <p>
 * 流程：读取 YAML 文件 → 深度合并覆盖项（覆盖项优先，支持点号键）→ 补齐默认值 → 校验类型。
 */
@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_DRY_RUN_OUTPUT = "target/functional-tests/dryRunOutput.json";

    private ConfigLoader() {
    }

    /**
     * 读取配置
     *
     * @param configFile YAML 配置文件，为 null 时仅使用覆盖项
     * @param overrides  覆盖项，可为 null
     */
    public static Config readConfigFile(Path configFile, Map<String, ?> overrides) {
        Map<String, Object> merged = configFile != null ? readYaml(configFile) : new LinkedHashMap<>();
        if (overrides != null) {
            deepMerge(merged, expandDottedKeys(overrides));
        }

        applyDefaults(merged);
        validate(merged);

        log.debug("Config resolved from {} with {} top-level keys",
                configFile != null ? configFile : "<overrides>", merged.size());
        return new MapConfig(merged);
    }

    // ==================== 读取 ====================

    private static Map<String, Object> readYaml(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigurationException(null, "Config file [" + configFile + "] does not exist");
        }

        try (InputStream is = Files.newInputStream(configFile)) {
            Object loaded = YamlUtils.createConfigYaml().load(is);
            if (loaded == null) {
                return new LinkedHashMap<>();
            }
            if (!(loaded instanceof Map)) {
                throw new ConfigurationException(null,
                        "Config file [" + configFile + "] must contain a mapping at its root");
            }
            return copyMap((Map<?, ?>) loaded);
        } catch (IOException e) {
            throw new ConfigurationException(null, "Unable to read config file [" + configFile + "]", e);
        } catch (YAMLException e) {
            throw new ConfigurationException(null,
                    "Invalid YAML in config file [" + configFile + "]: " + e.getMessage(), e);
        }
    }

    // ==================== 合并 ====================

    @SuppressWarnings("unchecked")
    static void deepMerge(Map<String, Object> target, Map<String, Object> source) {
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            Object existing = target.get(entry.getKey());
            Object incoming = entry.getValue();
            if (existing instanceof Map && incoming instanceof Map) {
                Map<String, Object> nested = copyMap((Map<?, ?>) existing);
                deepMerge(nested, (Map<String, Object>) incoming);
                target.put(entry.getKey(), nested);
            } else {
                target.put(entry.getKey(), incoming);
            }
        }
    }

    /**
     * 将 {@code mochaOpts.dryRun: true} 这类点号键展开为嵌套结构
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> expandDottedKeys(Map<String, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            Object value = entry.getValue() instanceof Map
                    ? expandDottedKeys(copyMap((Map<?, ?>) entry.getValue()))
                    : entry.getValue();

            String[] segments = entry.getKey().split("\\.");
            Map<String, Object> current = result;
            for (int i = 0; i < segments.length - 1; i++) {
                Object next = current.get(segments[i]);
                if (!(next instanceof Map)) {
                    next = new LinkedHashMap<String, Object>();
                    current.put(segments[i], next);
                }
                current = (Map<String, Object>) next;
            }

            String leaf = segments[segments.length - 1];
            if (current.get(leaf) instanceof Map && value instanceof Map) {
                deepMerge((Map<String, Object>) current.get(leaf), (Map<String, Object>) value);
            } else {
                current.put(leaf, value);
            }
        }
        return result;
    }

    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }

    // ==================== 默认值 ====================

    private static void applyDefaults(Map<String, Object> config) {
        config.putIfAbsent("testFiles", new ArrayList<>());
        config.putIfAbsent("testRunner", null);
        config.putIfAbsent("services", new LinkedHashMap<>());
        config.putIfAbsent("pageObjects", new LinkedHashMap<>());
        config.putIfAbsent("servicesRequiredForTestAnalysis", new ArrayList<>());
        config.putIfAbsent("dockerServers", new LinkedHashMap<>());

        Map<String, Object> mochaOpts = section(config, "mochaOpts");
        mochaOpts.putIfAbsent("dryRun", false);
        mochaOpts.putIfAbsent("dryRunOutput", DEFAULT_DRY_RUN_OUTPUT);
        mochaOpts.putIfAbsent("bail", false);
        mochaOpts.putIfAbsent("grep", null);

        Map<String, Object> suiteTags = section(config, "suiteTags");
        suiteTags.putIfAbsent("include", new ArrayList<>());
        suiteTags.putIfAbsent("exclude", new ArrayList<>());
    }

    private static Map<String, Object> section(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            Map<String, Object> created = new LinkedHashMap<>();
            config.put(key, created);
            return created;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException(key, "Expected config key [" + key + "] to be a mapping");
        }
        Map<String, Object> copy = copyMap((Map<?, ?>) value);
        config.put(key, copy);
        return copy;
    }

    // ==================== 校验 ====================

    private static void validate(Map<String, Object> config) {
        MapConfig view = new MapConfig(config);
        requireList(view, "testFiles");
        requireMap(view, "services");
        requireMap(view, "pageObjects");
        requireMap(view, "dockerServers");
        requireStringList(view, "servicesRequiredForTestAnalysis");
        requireType(view, "mochaOpts.dryRun", Boolean.class);
        requireType(view, "mochaOpts.bail", Boolean.class);
        requireType(view, "mochaOpts.dryRunOutput", String.class);
        requireType(view, "mochaOpts.grep", String.class);
        requireStringList(view, "suiteTags.include");
        requireStringList(view, "suiteTags.exclude");
    }

    private static void requireType(MapConfig view, String key, Class<?> type) {
        view.get(key, type);
    }

    private static void requireList(MapConfig view, String key) {
        if (view.get(key) == null) {
            throw new ConfigurationException(key, "Expected config key [" + key + "] to be a list");
        }
        view.get(key, List.class);
    }

    private static void requireMap(MapConfig view, String key) {
        if (view.get(key) == null) {
            throw new ConfigurationException(key, "Expected config key [" + key + "] to be a mapping");
        }
        view.get(key, Map.class);
    }

    private static void requireStringList(MapConfig view, String key) {
        requireList(view, key);
        for (Object item : view.getList(key)) {
            if (!(item instanceof String)) {
                throw new ConfigurationException(key,
                        "Expected config key [" + key + "] to contain only strings, got " + item);
            }
        }
    }
}
