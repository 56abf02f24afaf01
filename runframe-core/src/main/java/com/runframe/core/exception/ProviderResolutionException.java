package com.runframe.core.exception;

import com.runframe.api.exception.RunFrameException;
import com.runframe.api.provider.ProviderKind;

/**
 * 提供者解析异常
 * <p>
 * 工厂失败、未知依赖等，携带出错提供者的身份
 */
public class ProviderResolutionException extends RunFrameException {

    private final ProviderKind kind;
    private final String providerName;

    public ProviderResolutionException(ProviderKind kind, String providerName, String message) {
        super(message);
        this.kind = kind;
        this.providerName = providerName;
    }

    public ProviderResolutionException(ProviderKind kind, String providerName, String message, Throwable cause) {
        super(message, cause);
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
