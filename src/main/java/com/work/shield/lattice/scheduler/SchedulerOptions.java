package com.work.shield.lattice.scheduler;

import java.time.Duration;

import static com.work.shield.core.support.ValidationUtils.requirePositive;

/**
 * 调度器配置，不依赖任何框架。
 */
public class SchedulerOptions {

    private final Duration pollInterval;
    private final int maxConcurrent;
    private final Duration proofTimeout;
    private final boolean verifyBalances;
    private final boolean onChainMode;

    public SchedulerOptions(Duration pollInterval, int maxConcurrent, Duration proofTimeout,
                            boolean verifyBalances, boolean onChainMode) {
        this.pollInterval = requirePositive(pollInterval, "pollInterval");
        this.maxConcurrent = requirePositive(maxConcurrent, "maxConcurrent");
        this.proofTimeout = requirePositive(proofTimeout, "proofTimeout");
        this.verifyBalances = verifyBalances;
        this.onChainMode = onChainMode;
    }

    public static SchedulerOptions defaultOptions() {
        return new SchedulerOptions(Duration.ofSeconds(5), 10, Duration.ofMinutes(5), true, false);
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public Duration getProofTimeout() {
        return proofTimeout;
    }

    public boolean isVerifyBalances() {
        return verifyBalances;
    }

    public boolean isOnChainMode() {
        return onChainMode;
    }
}
