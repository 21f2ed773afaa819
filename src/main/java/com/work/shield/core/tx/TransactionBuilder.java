package com.work.shield.core.tx;

import com.work.shield.core.crypto.CommitmentScheme;
import com.work.shield.core.crypto.NoteEncryptor;
import com.work.shield.core.crypto.WalletSigner;
import com.work.shield.core.merkle.MerkleAccumulator;
import com.work.shield.core.merkle.MerkleProof;
import com.work.shield.core.model.EncryptedOutput;
import com.work.shield.core.model.Note;
import com.work.shield.core.model.ProofRequest;
import com.work.shield.core.model.Utxo;
import com.work.shield.core.model.Wallet;
import com.work.shield.core.support.ByteUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.work.shield.core.support.ValidationUtils.requireLength;
import static com.work.shield.core.support.ValidationUtils.requireNonNull;

/**
 * 从钱包 UTXO 状态组装证明请求。
 * <p>
 * 每个输入：承诺 → nullifier 签名 → nullifier → 交易绑定签名（覆盖 nullifier || 全部输出承诺，
 * 防止授权后替换输出）→ 包含证明。选中的 UTXO 在发送方钱包中被保留，构建失败时释放。
 * 调用方负责串行化对累加器的读取与写入。
 * </p>
 */
public class TransactionBuilder {

    private static final Logger log = LoggerFactory.getLogger(TransactionBuilder.class);

    private final MerkleAccumulator accumulator;
    private final NoteEncryptor encryptor;
    private final SecureRandom random;

    public TransactionBuilder(MerkleAccumulator accumulator, NoteEncryptor encryptor) {
        this(accumulator, encryptor, new SecureRandom());
    }

    public TransactionBuilder(MerkleAccumulator accumulator, NoteEncryptor encryptor, SecureRandom random) {
        this.accumulator = requireNonNull(accumulator, "accumulator");
        this.encryptor = requireNonNull(encryptor, "encryptor");
        this.random = requireNonNull(random, "random");
    }

    /**
     * @throws com.work.shield.core.exception.InsufficientFundsException 发送方可用余额不足
     */
    public BuiltTransaction build(Wallet sender, Wallet recipient, long amount, byte[] currentRoot) {
        requireNonNull(sender, "sender");
        requireNonNull(recipient, "recipient");
        requireLength(currentRoot, ByteUtils.HASH_LENGTH, "currentRoot");

        List<Utxo> selected = sender.selectUtxos(amount);
        try {
            return assemble(sender, recipient, amount, currentRoot, selected);
        } catch (RuntimeException e) {
            sender.release(selected);
            throw e;
        }
    }

    private BuiltTransaction assemble(Wallet sender, Wallet recipient, long amount, byte[] currentRoot,
                                      List<Utxo> selected) {
        long total = 0;
        for (Utxo utxo : selected) {
            total += utxo.getAmount();
        }
        long change = total - amount;

        Note recipientNote = new Note(amount, recipient.getOwnerKey(), freshBlinding());
        Note changeNote = change > 0 ? new Note(change, sender.getOwnerKey(), freshBlinding()) : null;
        List<Note> outputs = new ArrayList<>(2);
        outputs.add(recipientNote);
        if (changeNote != null) {
            outputs.add(changeNote);
        }
        List<byte[]> outputCommitments = new ArrayList<>(outputs.size());
        for (Note note : outputs) {
            outputCommitments.add(CommitmentScheme.commit(note));
        }

        WalletSigner signer = sender.getSigner();
        List<Note> inputNotes = new ArrayList<>(selected.size());
        List<byte[]> nullifierSignatures = new ArrayList<>(selected.size());
        List<byte[]> txSignatures = new ArrayList<>(selected.size());
        List<Long> inputIndices = new ArrayList<>(selected.size());
        List<MerkleProof> inputProofs = new ArrayList<>(selected.size());
        for (Utxo utxo : selected) {
            byte[] commitment = CommitmentScheme.commit(utxo.getNote());
            if (!Arrays.equals(commitment, utxo.getCommitment())) {
                throw new IllegalStateException("UTXO commitment drift at index " + utxo.getIndex());
            }
            byte[] nullifierSignature = signer.sign(commitment);
            byte[] nullifier = CommitmentScheme.nullifier(nullifierSignature);
            byte[] txSignature = signer.sign(CommitmentScheme.txBindingMessage(nullifier, outputCommitments));

            inputNotes.add(utxo.getNote());
            nullifierSignatures.add(nullifierSignature);
            txSignatures.add(txSignature);
            inputIndices.add(utxo.getIndex());
            inputProofs.add(accumulator.generateProof(utxo.getIndex()));
        }

        List<EncryptedOutput> encrypted = new ArrayList<>(outputs.size());
        encrypted.add(encryptor.encrypt(recipientNote, recipient.getPublicKey()).withCommitment(outputCommitments.get(0)));
        if (changeNote != null) {
            encrypted.add(encryptor.encrypt(changeNote, sender.getPublicKey()).withCommitment(outputCommitments.get(1)));
        }

        ProofRequest request = new ProofRequest(inputNotes, outputs, nullifierSignatures, txSignatures,
                inputIndices, inputProofs, currentRoot);
        log.debug("transaction built from={} to={} amount={} inputs={} change={}",
                sender.getId(), recipient.getId(), amount, selected.size(), change);
        return new BuiltTransaction(request, encrypted, outputCommitments, selected, recipientNote, changeNote);
    }

    private byte[] freshBlinding() {
        byte[] blinding = new byte[ByteUtils.HASH_LENGTH];
        random.nextBytes(blinding);
        return blinding;
    }
}
