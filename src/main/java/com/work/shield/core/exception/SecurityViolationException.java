package com.work.shield.core.exception;

/**
 * 输入 note 的承诺不在链上，或者不在声明的位置。属于致命错误，必须在证明计算之前抛出。
 */
public class SecurityViolationException extends ShieldException {

    public static final String CODE = "security_violation";

    private final int inputPosition;
    private final String commitment;
    private final long claimedIndex;
    private final Long actualIndex;

    public SecurityViolationException(int inputPosition, String commitment, long claimedIndex, Long actualIndex) {
        super(CODE, describe(inputPosition, commitment, claimedIndex, actualIndex));
        this.inputPosition = inputPosition;
        this.commitment = commitment;
        this.claimedIndex = claimedIndex;
        this.actualIndex = actualIndex;
    }

    private static String describe(int inputPosition, String commitment, long claimedIndex, Long actualIndex) {
        if (actualIndex == null) {
            return "Input " + inputPosition + " commitment " + commitment + " does not exist on-chain";
        }
        return "Input " + inputPosition + " index mismatch: claimed " + claimedIndex
                + " but commitment " + commitment + " is at " + actualIndex;
    }

    public int getInputPosition() {
        return inputPosition;
    }

    public String getCommitment() {
        return commitment;
    }

    public long getClaimedIndex() {
        return claimedIndex;
    }

    /**
     * @return 链上实际位置；承诺不存在时为 null
     */
    public Long getActualIndex() {
        return actualIndex;
    }
}
