package com.runframe.core.provider;

import com.runframe.api.provider.ProviderKind;
import lombok.NonNull;
import lombok.Value;

/**
 * 提供者身份：(类别, 名称)
 */
@Value
public class ProviderKey {
    ProviderKind kind;
    String name;

    public static ProviderKey service(String name) {
        return new ProviderKey(ProviderKind.SERVICE, name);
    }

    public static ProviderKey pageObject(String name) {
        return new ProviderKey(ProviderKind.PAGE_OBJECT, name);
    }

    @Override
    @NonNull
    public String toString() {
        return kind.getDisplayName() + ":" + name;
    }
}
