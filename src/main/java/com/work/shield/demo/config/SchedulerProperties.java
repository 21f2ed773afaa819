package com.work.shield.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 拓扑调度配置，转换为 {@link com.work.shield.lattice.scheduler.SchedulerOptions}。
 */
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private Duration pollInterval = Duration.ofSeconds(5);

    /**
     * 同时在途（PROVING/SUBMITTED）的边数上限
     */
    private int maxConcurrent = 10;

    private Duration proofTimeout = Duration.ofMinutes(5);

    private boolean verifyBalances = true;

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public Duration getProofTimeout() {
        return proofTimeout;
    }

    public void setProofTimeout(Duration proofTimeout) {
        this.proofTimeout = proofTimeout;
    }

    public boolean isVerifyBalances() {
        return verifyBalances;
    }

    public void setVerifyBalances(boolean verifyBalances) {
        this.verifyBalances = verifyBalances;
    }
}
