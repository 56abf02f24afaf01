package com.runframe.core.provider;

import com.runframe.api.provider.ProviderFactory;
import com.runframe.api.provider.ProviderKind;
import com.runframe.core.exception.ConfigurationException;
import com.runframe.core.util.ClassInstantiator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 将配置中的提供者声明转换为 {@link ProviderSpec}
 * <p>
 * 声明形如 {@code name -> 工厂}，工厂可以是：
 * <ul>
 *     <li>{@link ProviderFactory} 实例（编程式覆盖）</li>
 *     <li>实现 ProviderFactory 的 Class</li>
 *     <li>实现 ProviderFactory 的类全限定名（YAML 配置）</li>
 * </ul>
 */
public final class ProviderSpecReader {

    private ProviderSpecReader() {
    }

    public static List<ProviderSpec> read(ProviderKind kind, Object declarations) {
        if (declarations == null) {
            return Collections.emptyList();
        }
        if (!(declarations instanceof Map)) {
            throw new ConfigurationException(null,
                    "Expected " + kind + " declarations to be a map of name to factory, got "
                            + declarations.getClass().getSimpleName());
        }

        List<ProviderSpec> specs = new ArrayList<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) declarations).entrySet()) {
            String name = String.valueOf(entry.getKey());
            ProviderFactory factory = toFactory(kind + " [" + name + "]", entry.getValue());
            specs.add(new ProviderSpec(name, kind, factory));
        }
        return specs;
    }

    /**
     * 将单个声明值转换为工厂
     *
     * @param key 用于错误信息的声明位置描述
     */
    public static ProviderFactory toFactory(String key, Object value) {
        if (value instanceof ProviderFactory) {
            return (ProviderFactory) value;
        }
        if (value instanceof Class) {
            return ClassInstantiator.instantiate(key, (Class<?>) value, ProviderFactory.class);
        }
        if (value instanceof String && !((String) value).trim().isEmpty()) {
            return ClassInstantiator.instantiate(key, (String) value, ProviderFactory.class);
        }
        throw new ConfigurationException(key, "Expected a provider factory or factory class name for " + key
                + ", got " + (value == null ? "null" : value.getClass().getSimpleName()));
    }
}
