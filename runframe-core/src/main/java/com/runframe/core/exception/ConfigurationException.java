package com.runframe.core.exception;

import com.runframe.api.exception.RunFrameException;

/**
 * 配置异常
 * <p>
 * 配置缺失、类型不符、未定义测试等，在触碰任何提供者之前抛出
 */
public class ConfigurationException extends RunFrameException {

    private final String key;

    public ConfigurationException(String message) {
        super(message);
        this.key = null;
    }

    public ConfigurationException(String key, String message) {
        super(message);
        this.key = key;
    }

    public ConfigurationException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
