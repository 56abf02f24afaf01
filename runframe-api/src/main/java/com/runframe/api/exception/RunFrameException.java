package com.runframe.api.exception;

/**
 * RunFrame 异常基类
 * <p>
 * 框架内所有错误均为非受检异常，由运行入口统一向调用方暴露。
 */
public class RunFrameException extends RuntimeException {

    public RunFrameException(String message) {
        super(message);
    }

    public RunFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
