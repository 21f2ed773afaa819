package com.work.shield.core.queue;

import com.work.shield.core.model.ProofRequest;
import com.work.shield.core.model.ProofResult;
import com.work.shield.core.prover.ProverStatus;

import java.time.Instant;

/**
 * 队列内部的 job 记录。所有写操作都在 {@link ProofJobQueue} 的锁内完成，对外只暴露 {@link ProofJobView}。
 */
final class ProofJob {

    private final String id;
    private final ProofRequest request;
    private final Instant createdAt;
    private JobStage stage = JobStage.QUEUED;
    private String stageDescription;
    private int progress;
    private int queuePosition;
    private Instant startedAt;
    private Instant completedAt;
    private ProofResult result;
    private String error;
    private String diagnosticTail;

    ProofJob(String id, ProofRequest request, Instant createdAt) {
        this.id = id;
        this.request = request;
        this.createdAt = createdAt;
        this.stageDescription = "Queued";
    }

    String getId() {
        return id;
    }

    ProofRequest getRequest() {
        return request;
    }

    JobStage getStage() {
        return stage;
    }

    Instant getCompletedAt() {
        return completedAt;
    }

    void queuedAt(int position, int queueLength) {
        this.queuePosition = position;
        this.stageDescription = "Queued (position " + position + " of " + queueLength + ")";
    }

    void start(Instant now) {
        this.stage = JobStage.PREPARING;
        this.stageDescription = "Starting proof generation...";
        this.progress = 10;
        this.queuePosition = 0;
        this.startedAt = now;
    }

    /**
     * 应用证明器快照。非终态阶段只做展示；终态只能写入一次。
     */
    void apply(ProverStatus status, Instant now) {
        if (stage.isTerminal()) {
            return;
        }
        if (status.isTerminal()) {
            this.result = status.getResult();
            this.error = status.getError();
            this.diagnosticTail = status.getDiagnosticTail();
            this.completedAt = now;
        }
        this.stage = status.getStage();
        this.stageDescription = status.getMessage();
        this.progress = status.getProgress();
    }

    void fail(String error, Instant now) {
        if (stage.isTerminal()) {
            return;
        }
        this.stage = JobStage.ERROR;
        this.stageDescription = "Prover process error";
        this.progress = 0;
        this.error = error;
        this.completedAt = now;
    }

    ProofJobView view() {
        return new ProofJobView(id, stage, stageDescription, progress, queuePosition, createdAt, startedAt,
                completedAt, result, error, diagnosticTail);
    }
}
