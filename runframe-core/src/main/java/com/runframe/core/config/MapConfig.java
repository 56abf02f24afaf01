package com.runframe.core.config;

import com.runframe.api.config.Config;
import com.runframe.core.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于嵌套 Map 的只读配置
 * <p>
 * 构造时做深拷贝，之后不可变。
 */
public class MapConfig implements Config {

    private static final Object MISSING = new Object();

    private final Map<String, Object> values;

    public MapConfig(Map<String, ?> values) {
        this.values = freezeMap(values);
    }

    @Override
    public Object get(String path) {
        Object value = lookup(path);
        if (value == MISSING) {
            throw new ConfigurationException(path, "Unknown config key [" + path + "]");
        }
        return value;
    }

    @Override
    public <T> T get(String path, Class<T> type) {
        Object value = get(path);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new ConfigurationException(path, "Expected config key [" + path + "] to be a "
                    + type.getSimpleName() + ", got " + value.getClass().getSimpleName());
        }
        return type.cast(value);
    }

    @Override
    public Object getOrDefault(String path, Object defaultValue) {
        Object value = lookup(path);
        return value == MISSING ? defaultValue : value;
    }

    @Override
    public boolean has(String path) {
        return lookup(path) != MISSING;
    }

    @Override
    public List<?> getList(String path) {
        List<?> list = get(path, List.class);
        return list != null ? list : Collections.emptyList();
    }

    @Override
    public boolean getBoolean(String path) {
        Boolean value = get(path, Boolean.class);
        return Boolean.TRUE.equals(value);
    }

    /**
     * 完整配置树（只读）
     */
    public Map<String, Object> toMap() {
        return values;
    }

    private Object lookup(String path) {
        if (path == null || path.isEmpty()) {
            return MISSING;
        }
        Object current = values;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return MISSING;
            }
            Map<?, ?> map = (Map<?, ?>) current;
            if (!map.containsKey(segment)) {
                return MISSING;
            }
            current = map.get(segment);
        }
        return current;
    }

    // ==================== 深度冻结 ====================

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map) {
            return freezeMap((Map<?, ?>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @Override
    public String toString() {
        return "MapConfig" + values.keySet();
    }
}
