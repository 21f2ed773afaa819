package com.work.shield.lattice.balance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class EdgeBalanceVerification {

    private final String edgeId;
    private final WalletBalanceCheck sender;
    private final WalletBalanceCheck receiver;
    private final long expectedAmount;
    private final long receivedAmount;
    private final List<BalanceViolation> violations;

    EdgeBalanceVerification(String edgeId, WalletBalanceCheck sender, WalletBalanceCheck receiver,
                            long expectedAmount, long receivedAmount, List<BalanceViolation> violations) {
        this.edgeId = edgeId;
        this.sender = sender;
        this.receiver = receiver;
        this.expectedAmount = expectedAmount;
        this.receivedAmount = receivedAmount;
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public String getEdgeId() {
        return edgeId;
    }

    public WalletBalanceCheck getSender() {
        return sender;
    }

    public WalletBalanceCheck getReceiver() {
        return receiver;
    }

    public long getExpectedAmount() {
        return expectedAmount;
    }

    public long getReceivedAmount() {
        return receivedAmount;
    }

    public List<BalanceViolation> getViolations() {
        return violations;
    }
}
