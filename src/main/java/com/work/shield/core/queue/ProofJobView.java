package com.work.shield.core.queue;

import com.work.shield.core.model.ProofResult;

import java.time.Duration;
import java.time.Instant;

/**
 * job 状态的不可变快照，供轮询方读取。
 */
public final class ProofJobView {

    private final String jobId;
    private final JobStage stage;
    private final String stageDescription;
    private final int progress;
    private final int queuePosition;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final ProofResult result;
    private final String error;
    private final String diagnosticTail;

    public ProofJobView(String jobId, JobStage stage, String stageDescription, int progress, int queuePosition,
                        Instant createdAt, Instant startedAt, Instant completedAt, ProofResult result,
                        String error, String diagnosticTail) {
        this.jobId = jobId;
        this.stage = stage;
        this.stageDescription = stageDescription;
        this.progress = progress;
        this.queuePosition = queuePosition;
        this.createdAt = createdAt;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.result = result;
        this.error = error;
        this.diagnosticTail = diagnosticTail;
    }

    public String getJobId() {
        return jobId;
    }

    public JobStage getStage() {
        return stage;
    }

    public String getStageDescription() {
        return stageDescription;
    }

    public int getProgress() {
        return progress;
    }

    public int getQueuePosition() {
        return queuePosition;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    /**
     * @return 证明结果；仅 SUCCESS 时非空
     */
    public ProofResult getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    public String getDiagnosticTail() {
        return diagnosticTail;
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }

    /**
     * @return 从开始执行到完成的耗时；未完成时为 null
     */
    public Duration getDuration() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }
}
