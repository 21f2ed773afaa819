package com.work.shield.core.model;

/**
 * 证明器成功返回的结果。
 */
public final class ProofResult {

    private final byte[] proof;
    private final byte[] publicValuesRaw;
    private final PublicOutputs publicOutputs;
    private final byte[] vkeyHash;

    public ProofResult(byte[] proof, byte[] publicValuesRaw, PublicOutputs publicOutputs, byte[] vkeyHash) {
        this.proof = proof.clone();
        this.publicValuesRaw = publicValuesRaw.clone();
        this.publicOutputs = publicOutputs;
        this.vkeyHash = vkeyHash == null ? new byte[0] : vkeyHash.clone();
    }

    public byte[] getProof() {
        return proof.clone();
    }

    public byte[] getPublicValuesRaw() {
        return publicValuesRaw.clone();
    }

    public PublicOutputs getPublicOutputs() {
        return publicOutputs;
    }

    public byte[] getVkeyHash() {
        return vkeyHash.clone();
    }
}
