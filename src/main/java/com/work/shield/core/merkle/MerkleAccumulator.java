package com.work.shield.core.merkle;

/**
 * 只追加的承诺累加器。
 * <p>叶子编号按插入顺序从 0 开始分配，永不复用；对第 i 个叶子生成的证明，
 * 对生成时刻的根始终有效。</p>
 */
public interface MerkleAccumulator {

    byte[] root();

    /**
     * @return 新叶子的编号
     */
    long insert(byte[] leaf);

    MerkleProof generateProof(long index);

    long leafCount();

    /**
     * @return 承诺所在叶子编号；不存在时返回 -1
     */
    long indexOf(byte[] commitment);
}
