package com.work.shield.core.chain;

import com.work.shield.core.support.ByteUtils;

/**
 * 账本发出的承诺事件（Deposited / OutputCommitted），按发出顺序读取。
 */
public final class CommitmentEvent {

    public enum Kind {
        DEPOSIT,
        OUTPUT
    }

    private final Kind kind;
    private final byte[] commitment;
    private final long leafIndex;
    private final long blockNumber;
    private final long logIndex;

    public CommitmentEvent(Kind kind, byte[] commitment, long leafIndex, long blockNumber, long logIndex) {
        this.kind = kind;
        this.commitment = commitment.clone();
        this.leafIndex = leafIndex;
        this.blockNumber = blockNumber;
        this.logIndex = logIndex;
    }

    public Kind getKind() {
        return kind;
    }

    public byte[] getCommitment() {
        return commitment.clone();
    }

    public String getCommitmentHex() {
        return ByteUtils.toHex(commitment);
    }

    public long getLeafIndex() {
        return leafIndex;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public long getLogIndex() {
        return logIndex;
    }

    @Override
    public String toString() {
        return "CommitmentEvent{" + kind + ", leafIndex=" + leafIndex + ", block=" + blockNumber
                + ", commitment=" + getCommitmentHex() + "}";
    }
}
