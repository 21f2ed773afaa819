package com.work.shield.core.merkle;

import com.work.shield.core.support.ByteUtils;
import org.web3j.crypto.Hash;

/**
 * 与账本合约一致的 Keccak256 节点哈希与零子树表。
 */
public final class MerkleHashing {

    public static final int DEPTH = 32;

    private static final byte[][] ZEROS = new byte[DEPTH][];

    static {
        ZEROS[0] = ByteUtils.zero();
        for (int i = 1; i < DEPTH; i++) {
            ZEROS[i] = hashPair(ZEROS[i - 1], ZEROS[i - 1]);
        }
    }

    private MerkleHashing() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static byte[] hashPair(byte[] left, byte[] right) {
        return Hash.sha3(ByteUtils.concat(left, right));
    }

    /**
     * 高度为 level 的全空子树的根。
     */
    public static byte[] zero(int level) {
        return ZEROS[level].clone();
    }

    /**
     * 空树的根：合约初始化时写入的 ZEROS[DEPTH - 1]。
     */
    public static byte[] emptyRoot() {
        return zero(DEPTH - 1);
    }
}
