package com.work.shield.lattice.support.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class MetricsSummary {

    private final int proofsSubmitted;
    private final int proofsCompleted;
    private final int txConfirmed;
    private final Timing proofTime;
    private final Timing totalTime;
    private final Map<String, Integer> errorsByType;
    private final List<String> errors;
    private final int queueSamples;
    private final int maxQueueDepth;
    private final int maxActiveJobs;
    private final double avgQueueDepth;

    MetricsSummary(int proofsSubmitted, int proofsCompleted, int txConfirmed, Timing proofTime, Timing totalTime,
                   Map<String, Integer> errorsByType, List<String> errors, int queueSamples, int maxQueueDepth,
                   int maxActiveJobs, double avgQueueDepth) {
        this.proofsSubmitted = proofsSubmitted;
        this.proofsCompleted = proofsCompleted;
        this.txConfirmed = txConfirmed;
        this.proofTime = proofTime;
        this.totalTime = totalTime;
        this.errorsByType = Collections.unmodifiableMap(new LinkedHashMap<>(errorsByType));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.queueSamples = queueSamples;
        this.maxQueueDepth = maxQueueDepth;
        this.maxActiveJobs = maxActiveJobs;
        this.avgQueueDepth = avgQueueDepth;
    }

    public int getProofsSubmitted() {
        return proofsSubmitted;
    }

    public int getProofsCompleted() {
        return proofsCompleted;
    }

    public int getTxConfirmed() {
        return txConfirmed;
    }

    public Timing getProofTime() {
        return proofTime;
    }

    public Timing getTotalTime() {
        return totalTime;
    }

    public Map<String, Integer> getErrorsByType() {
        return errorsByType;
    }

    public int getTotalErrors() {
        int total = 0;
        for (int count : errorsByType.values()) {
            total += count;
        }
        return total;
    }

    public List<String> getErrors() {
        return errors;
    }

    public int getQueueSamples() {
        return queueSamples;
    }

    public int getMaxQueueDepth() {
        return maxQueueDepth;
    }

    public int getMaxActiveJobs() {
        return maxActiveJobs;
    }

    public double getAvgQueueDepth() {
        return avgQueueDepth;
    }

    /**
     * 耗时分布（毫秒），百分位取最近秩。
     */
    public static final class Timing {

        private final int count;
        private final long min;
        private final long max;
        private final long avg;
        private final long p50;
        private final long p95;
        private final long p99;

        private Timing(int count, long min, long max, long avg, long p50, long p95, long p99) {
            this.count = count;
            this.min = min;
            this.max = max;
            this.avg = avg;
            this.p50 = p50;
            this.p95 = p95;
            this.p99 = p99;
        }

        static Timing of(List<Long> samples) {
            if (samples.isEmpty()) {
                return new Timing(0, 0, 0, 0, 0, 0, 0);
            }
            List<Long> sorted = new ArrayList<>(samples);
            Collections.sort(sorted);
            long sum = 0;
            for (long v : sorted) {
                sum += v;
            }
            return new Timing(sorted.size(), sorted.get(0), sorted.get(sorted.size() - 1), sum / sorted.size(),
                    percentile(sorted, 50), percentile(sorted, 95), percentile(sorted, 99));
        }

        static long percentile(List<Long> sorted, int p) {
            int rank = (int) Math.ceil(p / 100.0 * sorted.size());
            return sorted.get(Math.max(0, Math.min(sorted.size() - 1, rank - 1)));
        }

        public int getCount() {
            return count;
        }

        public long getMin() {
            return min;
        }

        public long getMax() {
            return max;
        }

        public long getAvg() {
            return avg;
        }

        public long getP50() {
            return p50;
        }

        public long getP95() {
            return p95;
        }

        public long getP99() {
            return p99;
        }
    }
}
