package com.runframe.api.exception;

/**
 * 参数不满足契约
 * <p>
 * 携带参数名与被拒绝的原始值，例如无法解析的版本字符串、未知的生命周期阶段名或 docker 服务名。
 */
public class InvalidArgumentException extends RunFrameException {

    private final String paramName;
    private final Object invalidValue;

    public InvalidArgumentException(String paramName, Object invalidValue, String message) {
        this(paramName, invalidValue, message, null);
    }

    public InvalidArgumentException(String paramName, Object invalidValue, String message, Throwable cause) {
        super(message, cause);
        this.paramName = paramName;
        this.invalidValue = invalidValue;
    }

    public String getParamName() {
        return paramName;
    }

    /**
     * 被拒绝的值，可能为 null
     */
    public Object getInvalidValue() {
        return invalidValue;
    }
}
