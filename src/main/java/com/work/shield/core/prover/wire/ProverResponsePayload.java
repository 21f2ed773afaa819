package com.work.shield.core.prover.wire;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 外部证明器 stdout 输出的 JSON。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProverResponsePayload {

    private String proof;
    private String publicValuesRaw;
    private PublicOutputsPayload publicOutputs;
    private String vkeyHash;

    public String getProof() {
        return proof;
    }

    public void setProof(String proof) {
        this.proof = proof;
    }

    public String getPublicValuesRaw() {
        return publicValuesRaw;
    }

    public void setPublicValuesRaw(String publicValuesRaw) {
        this.publicValuesRaw = publicValuesRaw;
    }

    public PublicOutputsPayload getPublicOutputs() {
        return publicOutputs;
    }

    public void setPublicOutputs(PublicOutputsPayload publicOutputs) {
        this.publicOutputs = publicOutputs;
    }

    public String getVkeyHash() {
        return vkeyHash;
    }

    public void setVkeyHash(String vkeyHash) {
        this.vkeyHash = vkeyHash;
    }
}
