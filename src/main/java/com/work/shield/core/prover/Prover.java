package com.work.shield.core.prover;

import com.work.shield.core.model.ProofRequest;

/**
 * 外部证明能力。传输方式（子进程、网络、进程内模拟）是实现细节。
 * <p>submit 不阻塞；调用方通过 poll 轮询直到终态。</p>
 */
public interface Prover {

    ProverHandle submit(ProofRequest request);

    /**
     * @throws com.work.shield.core.exception.ProverFailureException 句柄未知
     */
    ProverStatus poll(ProverHandle handle);
}
