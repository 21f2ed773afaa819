package com.work.shield.lattice.scheduler;

/**
 * 调度过程中记录的错误类型。
 */
public final class ErrorTypes {

    public static final String WALLET_NOT_FOUND = "wallet_not_found";
    public static final String PROOF_SUBMISSION = "proof_submission";
    public static final String PROOF_GENERATION = "proof_generation";
    public static final String PROOF_POLL = "proof_poll";
    public static final String PROOF_TIMEOUT = "proof_timeout";
    public static final String RELAYER_SUBMISSION = "relayer_submission";
    public static final String ROOT_MISMATCH = "root_mismatch";
    public static final String DEPENDENCY_FAILED = "dependency_failed";

    private ErrorTypes() {
        throw new AssertionError("工具类不允许实例化");
    }
}
