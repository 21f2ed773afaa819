package com.work.shield.core.merkle;

import com.work.shield.core.chain.CommitmentEvent;
import com.work.shield.core.chain.LedgerClient;
import com.work.shield.core.exception.AccumulatorSyncException;
import com.work.shield.core.support.ByteUtils;
import com.work.shield.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 账本镜像树：从账本承诺日志重建本地树，并与账本报告的根比对。
 * <p>
 * 使用前必须先 {@link #sync()}；根不一致时所有后续 witness 都无意义，直接抛出
 * {@link AccumulatorSyncException}。
 * </p>
 */
public class OnChainMerkleAccumulator implements MerkleAccumulator {

    private static final Logger log = LoggerFactory.getLogger(OnChainMerkleAccumulator.class);

    private final LedgerClient ledger;
    private final long deploymentBlock;
    private IncrementalMerkleTree tree;

    public OnChainMerkleAccumulator(LedgerClient ledger, long deploymentBlock) {
        this.ledger = ValidationUtils.requireNonNull(ledger, "ledger");
        this.deploymentBlock = ValidationUtils.requireNonNegative(deploymentBlock, "deploymentBlock");
    }

    /**
     * 重放部署区块以来的承诺事件：按 leafIndex 去重，缺口补零叶子，重建后校验根。
     */
    public synchronized void sync() {
        List<CommitmentEvent> events = ledger.readCommitmentLog(deploymentBlock);
        Map<Long, byte[]> byIndex = new TreeMap<>();
        for (CommitmentEvent event : events) {
            byte[] existing = byIndex.putIfAbsent(event.getLeafIndex(), event.getCommitment());
            if (existing != null && !Arrays.equals(existing, event.getCommitment())) {
                log.warn("duplicate leafIndex={} keep={} ignore={}", event.getLeafIndex(),
                        ByteUtils.toHex(existing), event.getCommitmentHex());
            }
        }

        List<byte[]> leaves = new ArrayList<>();
        long expected = 0;
        for (Map.Entry<Long, byte[]> entry : byIndex.entrySet()) {
            while (expected < entry.getKey()) {
                log.warn("gap in commitment log at leafIndex={}, filling with zero leaf", expected);
                leaves.add(ByteUtils.zero());
                expected++;
            }
            leaves.add(entry.getValue());
            expected++;
        }

        IncrementalMerkleTree rebuilt = IncrementalMerkleTree.of(leaves);
        byte[] ledgerRoot = ledger.currentRoot();
        if (!Arrays.equals(rebuilt.root(), ledgerRoot)) {
            throw new AccumulatorSyncException("Merkle root mismatch after sync: local="
                    + ByteUtils.toHex(rebuilt.root()) + " ledger=" + ByteUtils.toHex(ledgerRoot)
                    + " leaves=" + leaves.size());
        }
        this.tree = rebuilt;
        log.info("on-chain merkle synced leaves={} events={} root={}", leaves.size(), events.size(),
                ByteUtils.toHex(ledgerRoot));
    }

    public boolean isSynced() {
        return tree != null;
    }

    /**
     * 只读比对，不抛异常。
     */
    public synchronized RootCheck verifyRoot() {
        return new RootCheck(requireSynced().root(), ledger.currentRoot());
    }

    @Override
    public synchronized byte[] root() {
        return requireSynced().root();
    }

    @Override
    public synchronized long insert(byte[] leaf) {
        return requireSynced().insert(leaf);
    }

    @Override
    public synchronized MerkleProof generateProof(long index) {
        return requireSynced().generateProof(index);
    }

    @Override
    public synchronized long leafCount() {
        return requireSynced().leafCount();
    }

    @Override
    public synchronized long indexOf(byte[] commitment) {
        return requireSynced().indexOf(commitment);
    }

    private IncrementalMerkleTree requireSynced() {
        if (tree == null) {
            throw new IllegalStateException("on-chain merkle accumulator not synced, call sync() first");
        }
        return tree;
    }

    public static final class RootCheck {

        private final byte[] localRoot;
        private final byte[] ledgerRoot;

        RootCheck(byte[] localRoot, byte[] ledgerRoot) {
            this.localRoot = localRoot;
            this.ledgerRoot = ledgerRoot;
        }

        public boolean matches() {
            return Arrays.equals(localRoot, ledgerRoot);
        }

        public String getLocalRoot() {
            return ByteUtils.toHex(localRoot);
        }

        public String getLedgerRoot() {
            return ByteUtils.toHex(ledgerRoot);
        }
    }
}
