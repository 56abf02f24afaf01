package com.runframe.core.util;

import com.runframe.core.exception.ConfigurationException;

/**
 * 按类名实例化配置中声明的扩展类（提供者工厂、测试文件）
 * <p>
 * 要求目标类实现期望类型并提供公共无参构造器。
 */
public final class ClassInstantiator {

    private ClassInstantiator() {
    }

    public static <T> T instantiate(String key, String className, Class<T> expectedType) {
        Class<?> type;
        try {
            type = Class.forName(className.trim(), true, defaultClassLoader());
        } catch (ClassNotFoundException | LinkageError e) {
            throw new ConfigurationException(key, "Unable to load class [" + className + "] for " + key, e);
        }
        return instantiate(key, type, expectedType);
    }

    public static <T> T instantiate(String key, Class<?> type, Class<T> expectedType) {
        // 强校验：必须实现期望的契约
        if (!expectedType.isAssignableFrom(type)) {
            throw new ConfigurationException(key,
                    "Class [" + type.getName() + "] configured for " + key + " must implement " + expectedType.getName());
        }
        try {
            return expectedType.cast(type.getDeclaredConstructor().newInstance());
        } catch (ReflectiveOperationException e) {
            throw new ConfigurationException(key,
                    "Failed to instantiate [" + type.getName() + "] for " + key + ": " + e.getMessage(), e);
        }
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader tccl = Thread.currentThread().getContextClassLoader();
        return tccl != null ? tccl : ClassInstantiator.class.getClassLoader();
    }
}
