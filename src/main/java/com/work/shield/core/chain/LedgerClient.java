package com.work.shield.core.chain;

import com.work.shield.core.exception.RelayerFailureException;

import java.util.List;

/**
 * 账本/中继访问抽象。
 * <p>
 * 读路径（承诺日志、当前根）供安全校验与链上镜像树使用；
 * 写路径提交已证明的交易。
 * </p>
 */
public interface LedgerClient {

    /**
     * @return 交易哈希
     * @throws RelayerFailureException 账本拒绝或调用失败
     */
    String submitTransaction(LedgerSubmission submission);

    /**
     * 从 fromBlock 起按发出顺序读取全部承诺事件。
     */
    List<CommitmentEvent> readCommitmentLog(long fromBlock);

    byte[] currentRoot();

    /**
     * 是否为本地模拟账本。只有模拟账本才允许跳过安全校验。
     */
    default boolean isSimulated() {
        return false;
    }
}
