package com.work.shield.core.merkle;

import com.work.shield.core.support.ByteUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 叶子到根的包含证明：DEPTH 个兄弟节点，方向由 leafIndex 的各个二进制位决定
 * （第 k 位为 0 表示当前节点在左）。
 */
public final class MerkleProof {

    private final long leafIndex;
    private final List<byte[]> siblings;

    public MerkleProof(long leafIndex, List<byte[]> siblings) {
        if (siblings == null || siblings.size() != MerkleHashing.DEPTH) {
            throw new IllegalArgumentException("siblings 数量必须为 " + MerkleHashing.DEPTH);
        }
        this.leafIndex = leafIndex;
        List<byte[]> copy = new ArrayList<>(siblings.size());
        for (byte[] sibling : siblings) {
            copy.add(sibling.clone());
        }
        this.siblings = Collections.unmodifiableList(copy);
    }

    public long getLeafIndex() {
        return leafIndex;
    }

    public List<byte[]> getSiblings() {
        return siblings;
    }

    /**
     * 第 level 层当前节点是否在右侧。
     */
    public boolean isRight(int level) {
        return ((leafIndex >>> level) & 1L) == 1L;
    }

    public byte[] computeRoot(byte[] leaf) {
        byte[] current = leaf;
        for (int level = 0; level < siblings.size(); level++) {
            byte[] sibling = siblings.get(level);
            current = isRight(level)
                    ? MerkleHashing.hashPair(sibling, current)
                    : MerkleHashing.hashPair(current, sibling);
        }
        return current;
    }

    public boolean verify(byte[] leaf, byte[] root) {
        return Arrays.equals(computeRoot(leaf), root);
    }

    @Override
    public String toString() {
        return "MerkleProof{leafIndex=" + leafIndex + ", firstSibling=" + ByteUtils.toHex(siblings.get(0)) + "}";
    }
}
