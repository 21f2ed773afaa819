package com.work.shield.core.tx;

import com.work.shield.core.model.EncryptedOutput;
import com.work.shield.core.model.Note;
import com.work.shield.core.model.ProofRequest;
import com.work.shield.core.model.Utxo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 构建结果：证明请求 + 链下加密输出 + 确认后更新钱包所需的上下文。
 * <p>输出顺序固定为 [接收方, 找零]，确认后按此顺序分配叶子编号。</p>
 */
public final class BuiltTransaction {

    private final ProofRequest request;
    private final List<EncryptedOutput> encryptedOutputs;
    private final List<byte[]> outputCommitments;
    private final List<Utxo> selectedUtxos;
    private final Note recipientNote;
    private final Note changeNote;

    BuiltTransaction(ProofRequest request, List<EncryptedOutput> encryptedOutputs, List<byte[]> outputCommitments,
                     List<Utxo> selectedUtxos, Note recipientNote, Note changeNote) {
        this.request = request;
        this.encryptedOutputs = Collections.unmodifiableList(new ArrayList<>(encryptedOutputs));
        this.outputCommitments = Collections.unmodifiableList(new ArrayList<>(outputCommitments));
        this.selectedUtxos = Collections.unmodifiableList(new ArrayList<>(selectedUtxos));
        this.recipientNote = recipientNote;
        this.changeNote = changeNote;
    }

    public ProofRequest getRequest() {
        return request;
    }

    public List<EncryptedOutput> getEncryptedOutputs() {
        return encryptedOutputs;
    }

    public List<byte[]> getOutputCommitments() {
        return outputCommitments;
    }

    public List<Utxo> getSelectedUtxos() {
        return selectedUtxos;
    }

    public Note getRecipientNote() {
        return recipientNote;
    }

    /**
     * @return 找零 note；恰好花完时为 null
     */
    public Note getChangeNote() {
        return changeNote;
    }

    public long getChangeAmount() {
        return changeNote == null ? 0 : changeNote.getAmount();
    }
}
