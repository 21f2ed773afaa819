package com.work.shield.core.exception;

/**
 * 查询了不存在（或已被清理）的 job。
 */
public class QueueLookupException extends ShieldException {

    public static final String CODE = "job_not_found";

    private final String jobId;

    public QueueLookupException(String jobId) {
        super(CODE, "Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
