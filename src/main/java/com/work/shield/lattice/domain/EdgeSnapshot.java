package com.work.shield.lattice.domain;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * 报告中使用的边快照。
 */
public final class EdgeSnapshot {

    private final String id;
    private final String from;
    private final String to;
    private final long amount;
    private final List<String> dependsOn;
    private final EdgeState state;
    private final String jobId;
    private final int queuePosition;
    private final String txHash;
    private final String error;
    private final Duration proofTime;
    private final Duration totalTime;
    private final List<Edge.StateChange> history;

    EdgeSnapshot(String id, String from, String to, long amount, List<String> dependsOn, EdgeState state,
                 String jobId, int queuePosition, String txHash, String error, Duration proofTime,
                 Duration totalTime, List<Edge.StateChange> history) {
        this.id = id;
        this.from = from;
        this.to = to;
        this.amount = amount;
        this.dependsOn = dependsOn;
        this.state = state;
        this.jobId = jobId;
        this.queuePosition = queuePosition;
        this.txHash = txHash;
        this.error = error;
        this.proofTime = proofTime;
        this.totalTime = totalTime;
        this.history = Collections.unmodifiableList(history);
    }

    public String getId() {
        return id;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public long getAmount() {
        return amount;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public EdgeState getState() {
        return state;
    }

    public String getJobId() {
        return jobId;
    }

    public int getQueuePosition() {
        return queuePosition;
    }

    public String getTxHash() {
        return txHash;
    }

    public String getError() {
        return error;
    }

    public Duration getProofTime() {
        return proofTime;
    }

    public Duration getTotalTime() {
        return totalTime;
    }

    public List<Edge.StateChange> getHistory() {
        return history;
    }
}
