package com.runframe.core.provider;

import com.runframe.api.provider.ProviderFactory;
import com.runframe.api.provider.ProviderKind;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * 提供者静态描述：名称、类别与工厂
 */
@Value
public class ProviderSpec {
    @NonNull
    String name;
    @NonNull
    ProviderKind kind;
    @With
    @NonNull
    ProviderFactory factory;

    public static ProviderSpec service(String name, ProviderFactory factory) {
        return new ProviderSpec(name, ProviderKind.SERVICE, factory);
    }

    public static ProviderSpec pageObject(String name, ProviderFactory factory) {
        return new ProviderSpec(name, ProviderKind.PAGE_OBJECT, factory);
    }

    public ProviderKey getKey() {
        return new ProviderKey(kind, name);
    }

    @Override
    public String toString() {
        return "ProviderSpec{" + getKey() + "}";
    }
}
