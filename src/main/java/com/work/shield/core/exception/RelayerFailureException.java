package com.work.shield.core.exception;

/**
 * 账本/中继拒绝了交易或调用失败。只影响对应的边，不影响整体运行。
 */
public class RelayerFailureException extends ShieldException {

    public static final String CODE = "relayer_failure";

    public RelayerFailureException(String message) {
        super(CODE, message);
    }

    public RelayerFailureException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return getCause() != null;
    }
}
