package com.work.shield.core.prover;

/**
 * 证明失败原因，对外统一格式为 {@code <code>:<detail>}。
 */
public enum ProverFailureReason {
    NONZERO_EXIT("nonzero-exit"),
    PARSE_ERROR("parse-error"),
    PROCESS_ERROR("process-error");

    private final String code;

    ProverFailureReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public String format(String detail) {
        return code + ":" + detail;
    }
}
