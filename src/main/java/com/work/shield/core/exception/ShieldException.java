package com.work.shield.core.exception;

/**
 * 组件内部的统一异常类型，每个子类携带稳定的错误码，便于宿主转换为 HTTP 错误或指标标签。
 */
public class ShieldException extends RuntimeException {

    private final String errorCode;

    public ShieldException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ShieldException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * 标识该异常是否可通过重试解决。默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
