package com.work.shield.core.exception;

/**
 * 外部证明器失败：非零退出码、输出无法解析、进程无法启动。
 */
public class ProverFailureException extends ShieldException {

    public static final String CODE = "prover_failure";

    public ProverFailureException(String message) {
        super(CODE, message);
    }

    public ProverFailureException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
