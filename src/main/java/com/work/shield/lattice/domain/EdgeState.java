package com.work.shield.lattice.domain;

/**
 * 边的生命周期：READY → PROVING → SUBMITTED → CONFIRMED，任意非终态都可进入 FAILED。
 * <p>状态只前进不回退。</p>
 */
public enum EdgeState {
    READY,
    PROVING,
    SUBMITTED,
    CONFIRMED,
    FAILED;

    public boolean isTerminal() {
        return this == CONFIRMED || this == FAILED;
    }

    public boolean canTransitionTo(EdgeState next) {
        if (isTerminal() || next == null) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        switch (this) {
            case READY:
                return next == PROVING;
            case PROVING:
                return next == SUBMITTED;
            case SUBMITTED:
                return next == CONFIRMED;
            default:
                return false;
        }
    }
}
