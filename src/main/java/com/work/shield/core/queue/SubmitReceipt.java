package com.work.shield.core.queue;

/**
 * submit 的即时回执。queuePosition 为 0 表示已经开始执行，否则为等待队列中的 1 起始位置。
 */
public final class SubmitReceipt {

    private final String jobId;
    private final int queuePosition;
    private final int activeJobs;
    private final int queuedJobs;

    public SubmitReceipt(String jobId, int queuePosition, int activeJobs, int queuedJobs) {
        this.jobId = jobId;
        this.queuePosition = queuePosition;
        this.activeJobs = activeJobs;
        this.queuedJobs = queuedJobs;
    }

    public String getJobId() {
        return jobId;
    }

    public int getQueuePosition() {
        return queuePosition;
    }

    public int getActiveJobs() {
        return activeJobs;
    }

    public int getQueuedJobs() {
        return queuedJobs;
    }
}
