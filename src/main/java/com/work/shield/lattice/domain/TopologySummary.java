package com.work.shield.lattice.domain;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 按状态计数与耗时统计。
 */
public final class TopologySummary {

    private final String name;
    private final int walletCount;
    private final int edgeCount;
    private final Map<EdgeState, Integer> countsByState;
    private final long avgProofMillis;
    private final long maxProofMillis;
    private final long avgTotalMillis;
    private final long maxTotalMillis;

    TopologySummary(String name, int walletCount, int edgeCount, Map<EdgeState, Integer> countsByState,
                    List<Long> proofMillis, List<Long> totalMillis) {
        this.name = name;
        this.walletCount = walletCount;
        this.edgeCount = edgeCount;
        this.countsByState = Collections.unmodifiableMap(countsByState);
        this.avgProofMillis = average(proofMillis);
        this.maxProofMillis = max(proofMillis);
        this.avgTotalMillis = average(totalMillis);
        this.maxTotalMillis = max(totalMillis);
    }

    private static long average(List<Long> values) {
        if (values.isEmpty()) {
            return 0;
        }
        long sum = 0;
        for (long v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    private static long max(List<Long> values) {
        long max = 0;
        for (long v : values) {
            max = Math.max(max, v);
        }
        return max;
    }

    public String getName() {
        return name;
    }

    public int getWalletCount() {
        return walletCount;
    }

    public int getEdgeCount() {
        return edgeCount;
    }

    public Map<EdgeState, Integer> getCountsByState() {
        return countsByState;
    }

    public int count(EdgeState state) {
        Integer count = countsByState.get(state);
        return count == null ? 0 : count;
    }

    public long getAvgProofMillis() {
        return avgProofMillis;
    }

    public long getMaxProofMillis() {
        return maxProofMillis;
    }

    public long getAvgTotalMillis() {
        return avgTotalMillis;
    }

    public long getMaxTotalMillis() {
        return maxTotalMillis;
    }
}
