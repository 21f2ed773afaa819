package com.work.shield.core.chain;

import com.work.shield.core.exception.RelayerFailureException;
import com.work.shield.core.merkle.IncrementalMerkleTree;
import com.work.shield.core.model.EncryptedOutput;
import com.work.shield.core.model.PublicOutputs;
import com.work.shield.core.prover.PublicValuesCodec;
import com.work.shield.core.support.ByteUtils;
import com.work.shield.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 进程内模拟账本：维护承诺树、历史根集合与已用 nullifier 集合，并按区块顺序记录承诺事件。
 * <p>
 * 校验规则与合约一致：oldRoot 必须是出现过的根，nullifier 不可重复使用，
 * 加密输出与证明输出的承诺逐一对应。每次存款或交易占用一个新区块。
 * </p>
 */
public class InMemoryLedgerClient implements LedgerClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLedgerClient.class);

    private final IncrementalMerkleTree tree = new IncrementalMerkleTree();
    private final Set<String> knownRoots = new HashSet<>();
    private final Set<String> spentNullifiers = new HashSet<>();
    private final List<CommitmentEvent> events = new ArrayList<>();
    private long blockNumber;

    public InMemoryLedgerClient() {
        knownRoots.add(ByteUtils.toHex(tree.root()));
    }

    /**
     * 模拟 deposit：把承诺追加到树上。
     *
     * @return 叶子编号
     */
    public synchronized long deposit(String from, long amount, byte[] commitment) {
        ValidationUtils.requireNonEmpty(from, "from");
        ValidationUtils.requireNonNegative(amount, "amount");
        long block = ++blockNumber;
        long leafIndex = append(CommitmentEvent.Kind.DEPOSIT, commitment, block, 0);
        log.info("mock ledger deposit from={} amount={} leafIndex={} block={}", from, amount, leafIndex, block);
        return leafIndex;
    }

    @Override
    public synchronized String submitTransaction(LedgerSubmission submission) {
        ValidationUtils.requireNonNull(submission, "submission");
        if (submission.getProof().length == 0) {
            throw new RelayerFailureException("Empty proof");
        }
        PublicOutputs outputs;
        try {
            outputs = PublicValuesCodec.decode(submission.getPublicValues());
        } catch (IllegalArgumentException e) {
            throw new RelayerFailureException("Invalid public values: " + e.getMessage());
        }

        String oldRoot = ByteUtils.toHex(outputs.getOldRoot());
        if (!knownRoots.contains(oldRoot)) {
            throw new RelayerFailureException("Unknown merkle root " + oldRoot);
        }
        Set<String> batch = new HashSet<>();
        for (byte[] nullifier : outputs.getNullifiers()) {
            String key = ByteUtils.toHex(nullifier);
            if (spentNullifiers.contains(key) || !batch.add(key)) {
                throw new RelayerFailureException("Nullifier already spent " + key);
            }
        }
        List<EncryptedOutput> encrypted = submission.getEncryptedOutputs();
        List<byte[]> commitments = outputs.getOutputCommitments();
        if (encrypted.size() != commitments.size()) {
            throw new RelayerFailureException("Encrypted outputs count " + encrypted.size()
                    + " does not match output commitments " + commitments.size());
        }
        for (int i = 0; i < commitments.size(); i++) {
            if (!Arrays.equals(encrypted.get(i).getCommitment(), commitments.get(i))) {
                throw new RelayerFailureException("Encrypted output " + i + " is not bound to output commitment");
            }
        }

        spentNullifiers.addAll(batch);
        long block = ++blockNumber;
        for (int i = 0; i < commitments.size(); i++) {
            append(CommitmentEvent.Kind.OUTPUT, commitments.get(i), block, i);
        }
        String txHash = ByteUtils.toHex(Hash.sha3(ByteUtils.concat(submission.getPublicValues(), submission.getProof())));
        log.info("mock ledger accepted tx={} block={} outputs={} root={}", txHash, block, commitments.size(),
                ByteUtils.toHex(tree.root()));
        return txHash;
    }

    private long append(CommitmentEvent.Kind kind, byte[] commitment, long block, long logIndex) {
        long leafIndex = tree.insert(commitment);
        knownRoots.add(ByteUtils.toHex(tree.root()));
        events.add(new CommitmentEvent(kind, commitment, leafIndex, block, logIndex));
        return leafIndex;
    }

    @Override
    public synchronized List<CommitmentEvent> readCommitmentLog(long fromBlock) {
        List<CommitmentEvent> out = new ArrayList<>();
        for (CommitmentEvent event : events) {
            if (event.getBlockNumber() >= fromBlock) {
                out.add(event);
            }
        }
        return out;
    }

    @Override
    public synchronized byte[] currentRoot() {
        return tree.root();
    }

    public synchronized boolean isKnownRoot(byte[] root) {
        return knownRoots.contains(ByteUtils.toHex(root));
    }

    public synchronized boolean isSpent(byte[] nullifier) {
        return spentNullifiers.contains(ByteUtils.toHex(nullifier));
    }

    public synchronized long leafCount() {
        return tree.leafCount();
    }

    @Override
    public boolean isSimulated() {
        return true;
    }
}
