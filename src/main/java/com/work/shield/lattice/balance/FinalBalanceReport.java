package com.work.shield.lattice.balance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class FinalBalanceReport {

    private final List<WalletBalanceCheck> wallets;

    FinalBalanceReport(List<WalletBalanceCheck> wallets) {
        this.wallets = Collections.unmodifiableList(new ArrayList<>(wallets));
    }

    public boolean isAllMatch() {
        for (WalletBalanceCheck check : wallets) {
            if (!check.matches()) {
                return false;
            }
        }
        return true;
    }

    public List<WalletBalanceCheck> getWallets() {
        return wallets;
    }
}
