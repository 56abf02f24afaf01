package com.runframe.core.exception;

import com.runframe.api.exception.RunFrameException;

/**
 * 生命周期阶段触发失败
 */
public class LifecyclePhaseException extends RunFrameException {

    private final String phaseName;

    public LifecyclePhaseException(String phaseName, String message) {
        super(message);
        this.phaseName = phaseName;
    }

    public LifecyclePhaseException(String phaseName, String message, Throwable cause) {
        super(message, cause);
        this.phaseName = phaseName;
    }

    public String getPhaseName() {
        return phaseName;
    }
}
