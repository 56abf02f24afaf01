package com.runframe.core.exception;

import com.runframe.api.provider.ProviderKind;

import java.util.Collections;
import java.util.List;

/**
 * 循环依赖
 */
public class ProviderCycleException extends ProviderResolutionException {

    private final List<String> cycle;

    public ProviderCycleException(ProviderKind kind, String providerName, List<String> cycle) {
        super(kind, providerName, "Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = Collections.unmodifiableList(cycle);
    }

    /**
     * 环路径，首尾为同一提供者，例如 [Service:a, Service:b, Service:a]
     */
    public List<String> getCycle() {
        return cycle;
    }
}
