package com.work.shield.core.exception;

/**
 * 本地镜像树与账本报告的根不一致，继续运行会产生无效证明。
 */
public class AccumulatorSyncException extends ShieldException {

    public static final String CODE = "accumulator_sync";

    public AccumulatorSyncException(String message) {
        super(CODE, message);
    }

    public AccumulatorSyncException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
