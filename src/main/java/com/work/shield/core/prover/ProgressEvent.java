package com.work.shield.core.prover;

import com.work.shield.core.queue.JobStage;

/**
 * 证明器上报的结构化进度事件。
 */
public final class ProgressEvent {

    private final JobStage stage;
    private final int progress;
    private final String message;

    public ProgressEvent(JobStage stage, int progress, String message) {
        if (stage == null || stage.isTerminal() || stage == JobStage.QUEUED) {
            throw new IllegalArgumentException("progress stage must be a running stage: " + stage);
        }
        this.stage = stage;
        this.progress = Math.max(0, Math.min(100, progress));
        this.message = message;
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
}
