package com.work.shield.lattice.balance;

/**
 * 余额诊断。只记录，不改变边的结果。
 */
public final class BalanceViolation {

    public enum Type {
        BALANCE_INCONSISTENT("balance_inconsistent"),
        WRONG_AMOUNT_RECEIVED("wrong_amount_received");

        private final String code;

        Type(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    private final Type type;
    private final String edgeId;
    private final String walletId;
    private final long expected;
    private final long actual;

    public BalanceViolation(Type type, String edgeId, String walletId, long expected, long actual) {
        this.type = type;
        this.edgeId = edgeId;
        this.walletId = walletId;
        this.expected = expected;
        this.actual = actual;
    }

    public Type getType() {
        return type;
    }

    /**
     * @return 所属边；最终校验时为 null
     */
    public String getEdgeId() {
        return edgeId;
    }

    public String getWalletId() {
        return walletId;
    }

    public long getExpected() {
        return expected;
    }

    public long getActual() {
        return actual;
    }

    @Override
    public String toString() {
        return type.getCode() + "{edge=" + edgeId + ", wallet=" + walletId + ", expected=" + expected
                + ", actual=" + actual + "}";
    }
}
