package com.work.shield.core.prover;

/**
 * 只保留最后 capacity 个字符的诊断输出缓冲。
 */
public final class DiagnosticTail {

    public static final int DEFAULT_CAPACITY = 2000;

    private final int capacity;
    private final StringBuilder buffer = new StringBuilder();

    public DiagnosticTail() {
        this(DEFAULT_CAPACITY);
    }

    public DiagnosticTail(int capacity) {
        this.capacity = capacity;
    }

    public synchronized void append(String line) {
        buffer.append(line).append('\n');
        int overflow = buffer.length() - capacity;
        if (overflow > 0) {
            buffer.delete(0, overflow);
        }
    }

    @Override
    public synchronized String toString() {
        return buffer.toString();
    }
}
