package com.runframe.api.provider;

/**
 * 提供者类别
 * <p>
 * 名称唯一性按类别划分：同名的 Service 与 PageObject 可以共存。
 */
public enum ProviderKind {

    SERVICE("Service"),

    PAGE_OBJECT("PageObject");

    private final String displayName;

    ProviderKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
