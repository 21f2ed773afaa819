package com.work.shield.lattice.balance;

import com.work.shield.core.model.Wallet;

/**
 * 单个钱包的检查点：运行余额与未花费 UTXO 之和是否一致。
 */
public final class WalletBalanceCheck {

    private final String walletId;
    private final long balance;
    private final long utxoTotal;
    private final int utxoCount;

    private WalletBalanceCheck(String walletId, long balance, long utxoTotal, int utxoCount) {
        this.walletId = walletId;
        this.balance = balance;
        this.utxoTotal = utxoTotal;
        this.utxoCount = utxoCount;
    }

    public static WalletBalanceCheck of(Wallet wallet) {
        synchronized (wallet) {
            return new WalletBalanceCheck(wallet.getId(), wallet.getBalance(), wallet.utxoTotal(),
                    wallet.getUtxos().size());
        }
    }

    public boolean matches() {
        return balance == utxoTotal;
    }

    public String getWalletId() {
        return walletId;
    }

    public long getBalance() {
        return balance;
    }

    public long getUtxoTotal() {
        return utxoTotal;
    }

    public int getUtxoCount() {
        return utxoCount;
    }
}
