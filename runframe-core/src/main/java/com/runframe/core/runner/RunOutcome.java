package com.runframe.core.runner;

import com.runframe.api.exception.RunFrameException;
import org.slf4j.Logger;

/**
 * 一次运行的结果：返回值、主错误（运行体）与收尾错误（close）
 * <p>
 * 取值规则见 {@link #unwrap(Logger)}：主错误优先，收尾错误只在运行体成功时抛出。
 *
 * @param <T> 运行体返回值类型
 */
public final class RunOutcome<T> {

    private final T value;
    private final Throwable primaryError;
    private final Throwable teardownError;

    private RunOutcome(T value, Throwable primaryError, Throwable teardownError) {
        this.value = value;
        this.primaryError = primaryError;
        this.teardownError = teardownError;
    }

    public static <T> RunOutcome<T> success(T value) {
        return new RunOutcome<>(value, null, null);
    }

    public static <T> RunOutcome<T> failure(Throwable error) {
        return new RunOutcome<>(null, error, null);
    }

    public RunOutcome<T> withTeardownError(Throwable error) {
        return new RunOutcome<>(value, primaryError, error);
    }

    public boolean isSuccess() {
        return primaryError == null && teardownError == null;
    }

    public Throwable getPrimaryError() {
        return primaryError;
    }

    public Throwable getTeardownError() {
        return teardownError;
    }

    /**
     * 取出结果
     * <ul>
     *     <li>运行体失败：抛出运行体错误；若收尾也失败，收尾错误只写日志</li>
     *     <li>运行体成功、收尾失败：抛出收尾错误</li>
     *     <li>都成功：返回值</li>
     * </ul>
     */
    public T unwrap(Logger log) {
        if (primaryError != null) {
            if (teardownError != null) {
                log.error("failed to close functional test runner", teardownError);
            }
            throw propagate(primaryError);
        }
        if (teardownError != null) {
            throw propagate(teardownError);
        }
        return value;
    }

    private static RuntimeException propagate(Throwable error) {
        if (error instanceof RuntimeException) {
            return (RuntimeException) error;
        }
        if (error instanceof Error) {
            throw (Error) error;
        }
        return new RunFrameException(error.getMessage(), error);
    }
}
