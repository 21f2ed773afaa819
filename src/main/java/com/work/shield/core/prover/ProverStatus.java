package com.work.shield.core.prover;

import com.work.shield.core.model.ProofResult;
import com.work.shield.core.queue.JobStage;

/**
 * 证明计算的状态快照。
 */
public final class ProverStatus {

    private final JobStage stage;
    private final int progress;
    private final String message;
    private final ProofResult result;
    private final String error;
    private final String diagnosticTail;

    private ProverStatus(JobStage stage, int progress, String message, ProofResult result,
                         String error, String diagnosticTail) {
        this.stage = stage;
        this.progress = progress;
        this.message = message;
        this.result = result;
        this.error = error;
        this.diagnosticTail = diagnosticTail;
    }

    public static ProverStatus running(ProgressEvent event) {
        return new ProverStatus(event.getStage(), event.getProgress(), event.getMessage(), null, null, null);
    }

    public static ProverStatus success(ProofResult result) {
        return new ProverStatus(JobStage.SUCCESS, 100, "Proof generated successfully", result, null, null);
    }

    public static ProverStatus failure(ProverFailureReason reason, String detail, String diagnosticTail) {
        return new ProverStatus(JobStage.ERROR, 0, "Proof generation failed", null, reason.format(detail), diagnosticTail);
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }

    public JobStage getStage() {
        return stage;
    }

    public int getProgress() {
        return progress;
    }

    public String getMessage() {
        return message;
    }

    public ProofResult getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    public String getDiagnosticTail() {
        return diagnosticTail;
    }
}
