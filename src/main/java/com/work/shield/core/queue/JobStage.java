package com.work.shield.core.queue;

/**
 * 证明 job 的阶段。非终态来自证明器的进度事件，只用于展示，不影响正确性。
 */
public enum JobStage {
    QUEUED(false),
    PREPARING(false),
    COMPUTING(false),
    PROVING(false),
    SUBMITTING(false),
    SUCCESS(true),
    ERROR(true);

    private final boolean terminal;

    JobStage(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * 是否占用一个执行槽位。
     */
    public boolean isActive() {
        return this == PREPARING || this == COMPUTING || this == PROVING || this == SUBMITTING;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
