package com.work.shield.demo.web.dto;

import com.work.shield.core.queue.SubmitReceipt;

public class SubmitProofResponse {

    private String jobId;
    private int queuePosition;
    private int activeJobs;
    private int queuedJobs;

    public static SubmitProofResponse of(SubmitReceipt receipt) {
        SubmitProofResponse response = new SubmitProofResponse();
        response.setJobId(receipt.getJobId());
        response.setQueuePosition(receipt.getQueuePosition());
        response.setActiveJobs(receipt.getActiveJobs());
        response.setQueuedJobs(receipt.getQueuedJobs());
        return response;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public int getQueuePosition() {
        return queuePosition;
    }

    public void setQueuePosition(int queuePosition) {
        this.queuePosition = queuePosition;
    }

    public int getActiveJobs() {
        return activeJobs;
    }

    public void setActiveJobs(int activeJobs) {
        this.activeJobs = activeJobs;
    }

    public int getQueuedJobs() {
        return queuedJobs;
    }

    public void setQueuedJobs(int queuedJobs) {
        this.queuedJobs = queuedJobs;
    }
}
