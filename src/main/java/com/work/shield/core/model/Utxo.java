package com.work.shield.core.model;

import com.work.shield.core.support.ByteUtils;

/**
 * 钱包持有的未花费 note，及其承诺在累加器中的叶子位置。
 */
public final class Utxo {

    private final Note note;
    private final byte[] commitment;
    private final long index;

    public Utxo(Note note, byte[] commitment, long index) {
        this.note = note;
        this.commitment = commitment.clone();
        this.index = index;
    }

    public Note getNote() {
        return note;
    }

    public long getAmount() {
        return note.getAmount();
    }

    public byte[] getCommitment() {
        return commitment.clone();
    }

    public String getCommitmentHex() {
        return ByteUtils.toHex(commitment);
    }

    public long getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return "Utxo{index=" + index + ", amount=" + note.getAmount() + ", commitment=" + getCommitmentHex() + "}";
    }
}
