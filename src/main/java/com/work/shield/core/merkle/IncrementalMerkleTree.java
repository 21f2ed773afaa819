package com.work.shield.core.merkle;

import com.work.shield.core.support.ByteUtils;
import com.work.shield.core.support.ValidationUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 本地增量 Merkle 树，深度 32。
 * <p>
 * 每一层只保存已填充的节点，缺失的右兄弟用零子树补齐，
 * 所以插入和生成证明都只需 O(DEPTH) 次哈希。非线程安全，由调用方串行化写入。
 * </p>
 */
public class IncrementalMerkleTree implements MerkleAccumulator {

    /**
     * levels.get(k) 为第 k 层已填充的节点；第 0 层即叶子。
     */
    private final List<List<byte[]>> levels = new ArrayList<>(MerkleHashing.DEPTH);
    private final Map<String, Long> indexByCommitment = new HashMap<>();
    private byte[] root = MerkleHashing.emptyRoot();

    public IncrementalMerkleTree() {
        for (int i = 0; i < MerkleHashing.DEPTH; i++) {
            levels.add(new ArrayList<>());
        }
    }

    /**
     * 按顺序重放叶子构建一棵树。
     */
    public static IncrementalMerkleTree of(List<byte[]> leaves) {
        IncrementalMerkleTree tree = new IncrementalMerkleTree();
        for (byte[] leaf : leaves) {
            tree.insert(leaf);
        }
        return tree;
    }

    @Override
    public byte[] root() {
        return root.clone();
    }

    @Override
    public long insert(byte[] leaf) {
        ValidationUtils.requireLength(leaf, ByteUtils.HASH_LENGTH, "leaf");
        long index = levels.get(0).size();
        byte[] current = leaf.clone();
        long position = index;
        for (int level = 0; level < MerkleHashing.DEPTH; level++) {
            List<byte[]> nodes = levels.get(level);
            if (position == nodes.size()) {
                nodes.add(current);
            } else {
                nodes.set((int) position, current);
            }
            boolean right = (position & 1L) == 1L;
            current = right
                    ? MerkleHashing.hashPair(nodes.get((int) (position - 1)), current)
                    : MerkleHashing.hashPair(current, MerkleHashing.zero(level));
            position >>>= 1;
        }
        root = current;
        // 同一承诺重复插入时保留第一次出现的位置
        indexByCommitment.putIfAbsent(ByteUtils.toHex(leaf), index);
        return index;
    }

    @Override
    public MerkleProof generateProof(long index) {
        if (index < 0 || index >= leafCount()) {
            throw new IllegalArgumentException("leaf index out of range: " + index + ", leafCount=" + leafCount());
        }
        List<byte[]> siblings = new ArrayList<>(MerkleHashing.DEPTH);
        long position = index;
        for (int level = 0; level < MerkleHashing.DEPTH; level++) {
            long siblingPosition = position ^ 1L;
            List<byte[]> nodes = levels.get(level);
            siblings.add(siblingPosition < nodes.size()
                    ? nodes.get((int) siblingPosition)
                    : MerkleHashing.zero(level));
            position >>>= 1;
        }
        return new MerkleProof(index, siblings);
    }

    @Override
    public long leafCount() {
        return levels.get(0).size();
    }

    @Override
    public long indexOf(byte[] commitment) {
        Long index = indexByCommitment.get(ByteUtils.toHex(commitment));
        return index == null ? -1 : index;
    }

    public byte[] leaf(long index) {
        return levels.get(0).get((int) index).clone();
    }
}
