package com.runframe.core.exception;

import com.runframe.api.provider.ProviderKind;

/**
 * 同一类别下重复注册同名提供者
 */
public class DuplicateProviderException extends ConfigurationException {

    private final ProviderKind kind;
    private final String providerName;

    public DuplicateProviderException(ProviderKind kind, String providerName) {
        super(null, "Duplicate " + kind + " provider [" + providerName + "]");
        this.kind = kind;
        this.providerName = providerName;
    }

    public ProviderKind getKind() {
        return kind;
    }

    public String getProviderName() {
        return providerName;
    }
}
