package com.work.shield.lattice.domain;

import com.work.shield.core.tx.BuiltTransaction;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.work.shield.core.support.ValidationUtils.requireNonEmpty;
import static com.work.shield.core.support.ValidationUtils.requireNonNull;

/**
 * 拓扑中的一次转账 from → to。
 * <p>状态转换由 {@link EdgeState#canTransitionTo} 约束，非法转换抛出 IllegalStateException。</p>
 */
public class Edge {

    private final String id;
    private final String from;
    private final String to;
    private final long amount;
    private final List<String> dependsOn;

    private EdgeState state = EdgeState.READY;
    private final List<StateChange> history = new ArrayList<>();
    private Instant startTime;
    private Instant proofCompleteTime;
    private Instant endTime;
    private String jobId;
    private int queuePosition;
    private String txHash;
    private String error;
    private BuiltTransaction transaction;

    public Edge(String id, String from, String to, long amount, List<String> dependsOn) {
        this.id = requireNonEmpty(id, "edgeId");
        this.from = requireNonEmpty(from, "from");
        this.to = requireNonEmpty(to, "to");
        if (amount <= 0) {
            throw new IllegalArgumentException("amount 必须大于0");
        }
        this.amount = amount;
        this.dependsOn = dependsOn == null
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(dependsOn));
    }

    public synchronized void transition(EdgeState next, Instant at) {
        requireNonNull(at, "at");
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("illegal edge transition " + id + ": " + state + " -> " + next);
        }
        history.add(new StateChange(state, next, at));
        state = next;
        if (next == EdgeState.PROVING) {
            startTime = at;
        } else if (next.isTerminal()) {
            endTime = at;
        }
    }

    public synchronized void fail(String reason, Instant at) {
        transition(EdgeState.FAILED, at);
        this.error = reason;
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

    public synchronized EdgeState getState() {
        return state;
    }

    public synchronized List<StateChange> getHistory() {
        return new ArrayList<>(history);
    }

    public synchronized Instant getStartTime() {
        return startTime;
    }

    public synchronized Instant getProofCompleteTime() {
        return proofCompleteTime;
    }

    public synchronized void markProofComplete(Instant at) {
        this.proofCompleteTime = at;
    }

    public synchronized Instant getEndTime() {
        return endTime;
    }

    public synchronized String getJobId() {
        return jobId;
    }

    public synchronized int getQueuePosition() {
        return queuePosition;
    }

    public synchronized void assignJob(String jobId, int queuePosition) {
        this.jobId = jobId;
        this.queuePosition = queuePosition;
    }

    public synchronized String getTxHash() {
        return txHash;
    }

    public synchronized void setTxHash(String txHash) {
        this.txHash = txHash;
    }

    public synchronized String getError() {
        return error;
    }

    public synchronized BuiltTransaction getTransaction() {
        return transaction;
    }

    public synchronized void setTransaction(BuiltTransaction transaction) {
        this.transaction = transaction;
    }

    /**
     * @return 开始到证明完成的耗时；未完成时为 null
     */
    public synchronized Duration proofDuration() {
        return startTime == null || proofCompleteTime == null ? null : Duration.between(startTime, proofCompleteTime);
    }

    public synchronized Duration totalDuration() {
        return startTime == null || endTime == null ? null : Duration.between(startTime, endTime);
    }

    public synchronized EdgeSnapshot snapshot() {
        return new EdgeSnapshot(id, from, to, amount, dependsOn, state, jobId, queuePosition, txHash, error,
                proofDuration(), totalDuration(), new ArrayList<>(history));
    }

    @Override
    public String toString() {
        return "Edge{" + id + " " + from + "->" + to + " amount=" + amount + " state=" + getState() + "}";
    }

    public static final class StateChange {

        private final EdgeState from;
        private final EdgeState to;
        private final Instant at;

        StateChange(EdgeState from, EdgeState to, Instant at) {
            this.from = from;
            this.to = to;
            this.at = at;
        }

        public EdgeState getFrom() {
            return from;
        }

        public EdgeState getTo() {
            return to;
        }

        public Instant getAt() {
            return at;
        }
    }
}
