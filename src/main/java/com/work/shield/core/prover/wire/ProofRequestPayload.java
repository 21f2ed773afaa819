package com.work.shield.core.prover.wire;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * 证明请求的 JSON 形式，既是 HTTP 入参也是外部证明器的 stdin 输入。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProofRequestPayload {

    private List<NotePayload> inputNotes;
    private List<NotePayload> outputNotes;
    private List<String> nullifierSignatures;
    private List<String> txSignatures;
    private List<Long> inputIndices;
    private List<List<String>> inputProofs;
    private String oldRoot;

    public List<NotePayload> getInputNotes() {
        return inputNotes;
    }

    public void setInputNotes(List<NotePayload> inputNotes) {
        this.inputNotes = inputNotes;
    }

    public List<NotePayload> getOutputNotes() {
        return outputNotes;
    }

    public void setOutputNotes(List<NotePayload> outputNotes) {
        this.outputNotes = outputNotes;
    }

    public List<String> getNullifierSignatures() {
        return nullifierSignatures;
    }

    public void setNullifierSignatures(List<String> nullifierSignatures) {
        this.nullifierSignatures = nullifierSignatures;
    }

    public List<String> getTxSignatures() {
        return txSignatures;
    }

    public void setTxSignatures(List<String> txSignatures) {
        this.txSignatures = txSignatures;
    }

    public List<Long> getInputIndices() {
        return inputIndices;
    }

    public void setInputIndices(List<Long> inputIndices) {
        this.inputIndices = inputIndices;
    }

    public List<List<String>> getInputProofs() {
        return inputProofs;
    }

    public void setInputProofs(List<List<String>> inputProofs) {
        this.inputProofs = inputProofs;
    }

    public String getOldRoot() {
        return oldRoot;
    }

    public void setOldRoot(String oldRoot) {
        this.oldRoot = oldRoot;
    }
}
