package com.work.shield.core.exception;

/**
 * 发送方未保留的 UTXO 不足以覆盖转账金额。
 */
public class InsufficientFundsException extends ValidationException {

    private final String walletId;
    private final long requested;
    private final long available;

    public InsufficientFundsException(String walletId, long requested, long available) {
        super("insufficient_funds", "Insufficient balance: wallet=" + walletId
                + " requested=" + requested + " available=" + available);
        this.walletId = walletId;
        this.requested = requested;
        this.available = available;
    }

    public String getWalletId() {
        return walletId;
    }

    public long getRequested() {
        return requested;
    }

    public long getAvailable() {
        return available;
    }
}
