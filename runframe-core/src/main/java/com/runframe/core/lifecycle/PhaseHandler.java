package com.runframe.core.lifecycle;

/**
 * 生命周期阶段处理器
 */
@FunctionalInterface
public interface PhaseHandler<A> {

    void handle(A arg) throws Exception;
}
