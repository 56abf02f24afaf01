package com.runframe.core.exception;

import com.runframe.api.exception.RunFrameException;

/**
 * 获取数据存储版本信息失败
 */
public class VersionCheckException extends RunFrameException {

    public VersionCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
