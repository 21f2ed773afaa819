package com.work.shield.demo.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.work.shield.lattice.domain.EdgeSnapshot;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class EdgeView {

    private String id;
    private String from;
    private String to;
    private long amount;
    private List<String> dependsOn;
    private String state;
    private String jobId;
    private int queuePosition;
    private String txHash;
    private String error;
    private Long proofMillis;
    private Long totalMillis;

    public static EdgeView of(EdgeSnapshot snapshot) {
        EdgeView v = new EdgeView();
        v.setId(snapshot.getId());
        v.setFrom(snapshot.getFrom());
        v.setTo(snapshot.getTo());
        v.setAmount(snapshot.getAmount());
        v.setDependsOn(snapshot.getDependsOn());
        v.setState(snapshot.getState().name());
        v.setJobId(snapshot.getJobId());
        v.setQueuePosition(snapshot.getQueuePosition());
        v.setTxHash(snapshot.getTxHash());
        v.setError(snapshot.getError());
        v.setProofMillis(snapshot.getProofTime() == null ? null : snapshot.getProofTime().toMillis());
        v.setTotalMillis(snapshot.getTotalTime() == null ? null : snapshot.getTotalTime().toMillis());
        return v;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getFrom() {
        return from;
    }

    public void setFrom(String from) {
        this.from = from;
    }

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }

    public long getAmount() {
        return amount;
    }

    public void setAmount(long amount) {
        this.amount = amount;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public void setDependsOn(List<String> dependsOn) {
        this.dependsOn = dependsOn;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
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

    public String getTxHash() {
        return txHash;
    }

    public void setTxHash(String txHash) {
        this.txHash = txHash;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Long getProofMillis() {
        return proofMillis;
    }

    public void setProofMillis(Long proofMillis) {
        this.proofMillis = proofMillis;
    }

    public Long getTotalMillis() {
        return totalMillis;
    }

    public void setTotalMillis(Long totalMillis) {
        this.totalMillis = totalMillis;
    }
}
