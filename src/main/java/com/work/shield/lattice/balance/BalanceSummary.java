package com.work.shield.lattice.balance;

public final class BalanceSummary {

    private final int totalVerifications;
    private final int walletChecks;
    private final int inconsistentCount;
    private final int wrongAmountCount;

    BalanceSummary(int totalVerifications, int walletChecks, int inconsistentCount, int wrongAmountCount) {
        this.totalVerifications = totalVerifications;
        this.walletChecks = walletChecks;
        this.inconsistentCount = inconsistentCount;
        this.wrongAmountCount = wrongAmountCount;
    }

    public boolean isAllValid() {
        return inconsistentCount == 0 && wrongAmountCount == 0;
    }

    public int getTotalVerifications() {
        return totalVerifications;
    }

    public int getWalletChecks() {
        return walletChecks;
    }

    public int getInconsistentCount() {
        return inconsistentCount;
    }

    public int getWrongAmountCount() {
        return wrongAmountCount;
    }
}
