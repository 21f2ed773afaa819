package com.work.shield.demo.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.work.shield.core.prover.wire.ProverResponsePayload;

import java.time.Instant;

/**
 * 任务状态视图；result 只在 success 时出现，error/diagnosticTail 只在 error 时出现。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProofStatusResponse {

    private String jobId;
    private String stage;
    private String stageDescription;
    private int progress;
    private int queuePosition;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMillis;
    private ProverResponsePayload result;
    private String error;
    private String diagnosticTail;

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getStage() {
        return stage;
    }

    public void setStage(String stage) {
        this.stage = stage;
    }

    public String getStageDescription() {
        return stageDescription;
    }

    public void setStageDescription(String stageDescription) {
        this.stageDescription = stageDescription;
    }

    public int getProgress() {
        return progress;
    }

    public void setProgress(int progress) {
        this.progress = progress;
    }

    public int getQueuePosition() {
        return queuePosition;
    }

    public void setQueuePosition(int queuePosition) {
        this.queuePosition = queuePosition;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Long getDurationMillis() {
        return durationMillis;
    }

    public void setDurationMillis(Long durationMillis) {
        this.durationMillis = durationMillis;
    }

    public ProverResponsePayload getResult() {
        return result;
    }

    public void setResult(ProverResponsePayload result) {
        this.result = result;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getDiagnosticTail() {
        return diagnosticTail;
    }

    public void setDiagnosticTail(String diagnosticTail) {
        this.diagnosticTail = diagnosticTail;
    }
}
