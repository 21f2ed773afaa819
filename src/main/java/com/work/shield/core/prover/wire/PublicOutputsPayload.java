package com.work.shield.core.prover.wire;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PublicOutputsPayload {

    private String oldRoot;
    private String newRoot;
    private List<String> nullifiers;
    private List<String> outputCommitments;

    public String getOldRoot() {
        return oldRoot;
    }

    public void setOldRoot(String oldRoot) {
        this.oldRoot = oldRoot;
    }

    public String getNewRoot() {
        return newRoot;
    }

    public void setNewRoot(String newRoot) {
        this.newRoot = newRoot;
    }

    public List<String> getNullifiers() {
        return nullifiers;
    }

    public void setNullifiers(List<String> nullifiers) {
        this.nullifiers = nullifiers;
    }

    public List<String> getOutputCommitments() {
        return outputCommitments;
    }

    public void setOutputCommitments(List<String> outputCommitments) {
        this.outputCommitments = outputCommitments;
    }
}
