package com.work.shield.lattice.support.metrics;

import com.work.shield.core.queue.QueueStatus;

import java.time.Duration;

/**
 * 调度器的可观测性端口，核心路径只调用接口，不绑定具体 metrics 实现。
 */
public interface LatticeMetrics {

    default void proofSubmitted(String edgeId, String jobId, int queuePosition) {
    }

    default void proofCompleted(String edgeId, Duration proofTime) {
    }

    default void txConfirmed(String edgeId, Duration totalTime) {
    }

    /**
     * @param type 错误类型，如 proof_generation、relayer_submission、root_mismatch
     */
    default void error(String edgeId, String type, String message) {
    }

    default void queueSnapshot(QueueStatus status) {
    }
}
