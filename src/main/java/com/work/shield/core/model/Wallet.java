package com.work.shield.core.model;

import com.work.shield.core.crypto.WalletSigner;
import com.work.shield.core.exception.InsufficientFundsException;
import com.work.shield.core.support.ValidationUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 模拟钱包：持有签名密钥、未花费 UTXO 集合与运行余额。
 * <p>
 * 余额通过 credit/spend 增减，独立于 UTXO 集合维护，这样余额校验才有意义：
 * 任何检查点上 balance 必须等于所有未花费 UTXO 金额之和。
 * 被在途边选中的 UTXO 会被 reserve，避免两个并发转账花同一个输入。
 * </p>
 */
public class Wallet {

    private final String id;
    private final WalletSigner signer;
    private final List<Utxo> utxos = new ArrayList<>();
    private final Set<Long> reserved = new HashSet<>();
    private long balance;

    public Wallet(String id, WalletSigner signer) {
        this.id = ValidationUtils.requireNonEmpty(id, "walletId");
        this.signer = ValidationUtils.requireNonNull(signer, "signer");
    }

    public String getId() {
        return id;
    }

    public WalletSigner getSigner() {
        return signer;
    }

    public String getAddress() {
        return signer.address();
    }

    public byte[] getOwnerKey() {
        return signer.ownerKey();
    }

    public byte[] getPublicKey() {
        return signer.publicKey();
    }

    public synchronized long getBalance() {
        return balance;
    }

    public synchronized List<Utxo> getUtxos() {
        return new ArrayList<>(utxos);
    }

    public synchronized long utxoTotal() {
        long total = 0;
        for (Utxo utxo : utxos) {
            total += utxo.getAmount();
        }
        return total;
    }

    /**
     * @return 最近一次入账的 UTXO；没有 UTXO 时为 null
     */
    public synchronized Utxo latestUtxo() {
        return utxos.isEmpty() ? null : utxos.get(utxos.size() - 1);
    }

    public synchronized void credit(Utxo utxo) {
        ValidationUtils.requireNonNull(utxo, "utxo");
        utxos.add(utxo);
        balance += utxo.getAmount();
    }

    /**
     * 大额优先选择未保留的 UTXO 覆盖 amount，并把选中的 UTXO 标记为保留。
     *
     * @throws InsufficientFundsException 可用 UTXO 不足
     */
    public synchronized List<Utxo> selectUtxos(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount 必须大于0");
        }
        List<Utxo> candidates = new ArrayList<>();
        long available = 0;
        for (Utxo utxo : utxos) {
            if (!reserved.contains(utxo.getIndex())) {
                candidates.add(utxo);
                available += utxo.getAmount();
            }
        }
        candidates.sort(Comparator.comparingLong(Utxo::getAmount).reversed());

        List<Utxo> selected = new ArrayList<>();
        long total = 0;
        for (Utxo utxo : candidates) {
            if (total >= amount) {
                break;
            }
            selected.add(utxo);
            total += utxo.getAmount();
        }
        if (total < amount) {
            throw new InsufficientFundsException(id, amount, available);
        }
        for (Utxo utxo : selected) {
            reserved.add(utxo.getIndex());
        }
        return selected;
    }

    /**
     * 转账失败时释放保留的输入。
     */
    public synchronized void release(Collection<Utxo> selected) {
        for (Utxo utxo : selected) {
            reserved.remove(utxo.getIndex());
        }
    }

    /**
     * 确认后把输入标记为已花费：移出集合并扣减余额。
     */
    public synchronized void spend(Collection<Utxo> spent) {
        for (Utxo utxo : spent) {
            boolean removed = utxos.removeIf(u -> u.getIndex() == utxo.getIndex());
            reserved.remove(utxo.getIndex());
            if (removed) {
                balance -= utxo.getAmount();
            }
        }
    }

    @Override
    public String toString() {
        return "Wallet{id=" + id + ", balance=" + getBalance() + "}";
    }
}
