package com.work.shield.core.config;

import java.time.Duration;

import static com.work.shield.core.support.ValidationUtils.requirePositive;

/**
 * 证明队列配置，不依赖任何框架。宿主应用在装配时把读取到的配置注入即可。
 */
public class ProofQueueConfig {

    private final int maxConcurrent;
    private final Duration completedRetention;
    private final Duration proverPollInterval;

    public ProofQueueConfig(int maxConcurrent, Duration completedRetention, Duration proverPollInterval) {
        this.maxConcurrent = requirePositive(maxConcurrent, "maxConcurrent");
        this.completedRetention = requirePositive(completedRetention, "completedRetention");
        this.proverPollInterval = requirePositive(proverPollInterval, "proverPollInterval");
    }

    /**
     * 默认完全串行：每个 job 都内嵌 oldRoot 快照，并发执行会在即将被推进的根上产出过期证明。
     */
    public static ProofQueueConfig defaultConfig() {
        return new ProofQueueConfig(1, Duration.ofMinutes(10), Duration.ofMillis(500));
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public Duration getCompletedRetention() {
        return completedRetention;
    }

    public Duration getProverPollInterval() {
        return proverPollInterval;
    }
}
