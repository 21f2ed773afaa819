package com.work.shield.core.prover;

import com.work.shield.core.model.ProofResult;
import com.work.shield.core.queue.JobStage;

/**
 * 一次证明计算的可变状态，由执行方写入、由 poll 读取快照。终态之后的写入被忽略。
 */
final class ProverExecution {

    private final DiagnosticTail tail = new DiagnosticTail();
    private ProverStatus status = ProverStatus.running(new ProgressEvent(JobStage.PREPARING, 0, "Initializing prover..."));

    DiagnosticTail tail() {
        return tail;
    }

    synchronized void progress(ProgressEvent event) {
        if (!status.isTerminal()) {
            status = ProverStatus.running(event);
        }
    }

    synchronized void succeed(ProofResult result) {
        if (!status.isTerminal()) {
            status = ProverStatus.success(result);
        }
    }

    synchronized void fail(ProverFailureReason reason, String detail) {
        if (!status.isTerminal()) {
            status = ProverStatus.failure(reason, detail, tail.toString());
        }
    }

    synchronized ProverStatus snapshot() {
        return status;
    }
}
