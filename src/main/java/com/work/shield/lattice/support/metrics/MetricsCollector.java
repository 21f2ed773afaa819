package com.work.shield.lattice.support.metrics;

import com.work.shield.core.queue.QueueStatus;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次运行的内存指标采集，运行结束后输出 {@link MetricsSummary}。
 */
public class MetricsCollector implements LatticeMetrics {

    private int proofsSubmitted;
    private int proofsCompleted;
    private int txConfirmed;
    private final List<Long> proofMillis = new ArrayList<>();
    private final List<Long> totalMillis = new ArrayList<>();
    private final Map<String, Integer> errorsByType = new LinkedHashMap<>();
    private final List<String> errorLog = new ArrayList<>();
    private int queueSamples;
    private long queueDepthSum;
    private int maxQueueDepth;
    private int maxActiveJobs;

    @Override
    public synchronized void proofSubmitted(String edgeId, String jobId, int queuePosition) {
        proofsSubmitted++;
    }

    @Override
    public synchronized void proofCompleted(String edgeId, Duration proofTime) {
        proofsCompleted++;
        if (proofTime != null) {
            proofMillis.add(proofTime.toMillis());
        }
    }

    @Override
    public synchronized void txConfirmed(String edgeId, Duration totalTime) {
        txConfirmed++;
        if (totalTime != null) {
            totalMillis.add(totalTime.toMillis());
        }
    }

    @Override
    public synchronized void error(String edgeId, String type, String message) {
        errorsByType.merge(type, 1, Integer::sum);
        errorLog.add(type + "[" + edgeId + "]: " + message);
    }

    @Override
    public synchronized void queueSnapshot(QueueStatus status) {
        queueSamples++;
        queueDepthSum += status.getQueuedJobs();
        maxQueueDepth = Math.max(maxQueueDepth, status.getQueuedJobs());
        maxActiveJobs = Math.max(maxActiveJobs, status.getActiveJobs());
    }

    public synchronized int errorCount(String type) {
        Integer count = errorsByType.get(type);
        return count == null ? 0 : count;
    }

    public synchronized MetricsSummary summary() {
        double avgDepth = queueSamples == 0 ? 0 : (double) queueDepthSum / queueSamples;
        return new MetricsSummary(proofsSubmitted, proofsCompleted, txConfirmed,
                MetricsSummary.Timing.of(proofMillis), MetricsSummary.Timing.of(totalMillis),
                errorsByType, errorLog, queueSamples, maxQueueDepth, maxActiveJobs, avgDepth);
    }
}
