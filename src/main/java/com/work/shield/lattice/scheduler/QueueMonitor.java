package com.work.shield.lattice.scheduler;

import com.work.shield.core.ProofService;
import com.work.shield.lattice.support.metrics.LatticeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * 独立于主循环的定时器，按固定间隔采样队列状态写入指标。
 */
class QueueMonitor {

    private static final Logger log = LoggerFactory.getLogger(QueueMonitor.class);

    private final ProofService proofService;
    private final LatticeMetrics metrics;
    private final Duration interval;
    private ScheduledExecutorService timer;

    QueueMonitor(ProofService proofService, LatticeMetrics metrics, Duration interval) {
        this.proofService = proofService;
        this.metrics = metrics;
        this.interval = interval;
    }

    synchronized void start() {
        if (timer != null) {
            return;
        }
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName("queue-monitor-" + t.getId());
            t.setDaemon(true);
            return t;
        };
        timer = Executors.newSingleThreadScheduledExecutor(tf);
        timer.scheduleAtFixedRate(this::sample, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    synchronized void stop() {
        if (timer != null) {
            timer.shutdownNow();
            timer = null;
        }
    }

    synchronized boolean isRunning() {
        return timer != null;
    }

    private void sample() {
        try {
            metrics.queueSnapshot(proofService.queueStatus());
        } catch (RuntimeException e) {
            log.warn("queue status sample failed err={}", e.getMessage());
        }
    }
}
