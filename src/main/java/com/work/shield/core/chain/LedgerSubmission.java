package com.work.shield.core.chain;

import com.work.shield.core.model.EncryptedOutput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 提交给账本/中继的交易：加密输出 + 证明 + 原始公开值。
 */
public final class LedgerSubmission {

    private final List<EncryptedOutput> encryptedOutputs;
    private final byte[] proof;
    private final byte[] publicValues;

    public LedgerSubmission(List<EncryptedOutput> encryptedOutputs, byte[] proof, byte[] publicValues) {
        this.encryptedOutputs = Collections.unmodifiableList(new ArrayList<>(encryptedOutputs));
        this.proof = proof.clone();
        this.publicValues = publicValues.clone();
    }

    public List<EncryptedOutput> getEncryptedOutputs() {
        return encryptedOutputs;
    }

    public byte[] getProof() {
        return proof.clone();
    }

    public byte[] getPublicValues() {
        return publicValues.clone();
    }
}
