package com.work.shield.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 证明的公开输出：旧根、新根、nullifier 列表、输出承诺列表。
 */
public final class PublicOutputs {

    private final byte[] oldRoot;
    private final byte[] newRoot;
    private final List<byte[]> nullifiers;
    private final List<byte[]> outputCommitments;

    public PublicOutputs(byte[] oldRoot, byte[] newRoot, List<byte[]> nullifiers, List<byte[]> outputCommitments) {
        this.oldRoot = oldRoot.clone();
        this.newRoot = newRoot.clone();
        this.nullifiers = Collections.unmodifiableList(new ArrayList<>(nullifiers));
        this.outputCommitments = Collections.unmodifiableList(new ArrayList<>(outputCommitments));
    }

    public byte[] getOldRoot() {
        return oldRoot.clone();
    }

    public byte[] getNewRoot() {
        return newRoot.clone();
    }

    public List<byte[]> getNullifiers() {
        return nullifiers;
    }

    public List<byte[]> getOutputCommitments() {
        return outputCommitments;
    }
}
