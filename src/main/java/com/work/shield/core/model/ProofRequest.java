package com.work.shield.core.model;

import com.work.shield.core.merkle.MerkleProof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次证明计算的完整输入。
 * <p>inputNotes / nullifierSignatures / txSignatures / inputIndices / inputProofs 按位置一一对应。</p>
 */
public final class ProofRequest {

    private final List<Note> inputNotes;
    private final List<Note> outputNotes;
    private final List<byte[]> nullifierSignatures;
    private final List<byte[]> txSignatures;
    private final List<Long> inputIndices;
    private final List<MerkleProof> inputProofs;
    private final byte[] oldRoot;

    public ProofRequest(List<Note> inputNotes,
                        List<Note> outputNotes,
                        List<byte[]> nullifierSignatures,
                        List<byte[]> txSignatures,
                        List<Long> inputIndices,
                        List<MerkleProof> inputProofs,
                        byte[] oldRoot) {
        this.inputNotes = copy(inputNotes);
        this.outputNotes = copy(outputNotes);
        this.nullifierSignatures = copy(nullifierSignatures);
        this.txSignatures = copy(txSignatures);
        this.inputIndices = copy(inputIndices);
        this.inputProofs = copy(inputProofs);
        this.oldRoot = oldRoot == null ? null : oldRoot.clone();
    }

    private static <T> List<T> copy(List<T> source) {
        return source == null ? null : Collections.unmodifiableList(new ArrayList<>(source));
    }

    public List<Note> getInputNotes() {
        return inputNotes;
    }

    public List<Note> getOutputNotes() {
        return outputNotes;
    }

    public List<byte[]> getNullifierSignatures() {
        return nullifierSignatures;
    }

    public List<byte[]> getTxSignatures() {
        return txSignatures;
    }

    public List<Long> getInputIndices() {
        return inputIndices;
    }

    public List<MerkleProof> getInputProofs() {
        return inputProofs;
    }

    public byte[] getOldRoot() {
        return oldRoot == null ? null : oldRoot.clone();
    }
}
