package com.work.shield.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 证明器与证明队列配置，由配置类转换为 core 包的 {@link com.work.shield.core.config.ProofQueueConfig}。
 *
 * mode=mock: 使用 SimulatedProver
 * mode=process: 启动外部证明进程（command）
 */
@ConfigurationProperties(prefix = "prover")
public class ProverProperties {

    private String mode = "mock";

    /**
     * 外部证明器命令行，例如 ["./target/release/prover", "--prove"]
     */
    private List<String> command = new ArrayList<>();

    private String workingDirectory;

    private Map<String, String> environment = new LinkedHashMap<>();

    /**
     * 同时运行的证明任务数，证明器资源消耗大，默认 1
     */
    private int maxConcurrent = 1;

    /**
     * 终态任务保留时长，超过后被清理
     */
    private Duration completedRetention = Duration.ofMinutes(10);

    private Duration pollInterval = Duration.ofMillis(500);

    /**
     * 清理任务执行间隔（毫秒）
     */
    private long evictionIntervalMs = 60_000L;

    /**
     * mock 证明器每个阶段的模拟耗时
     */
    private Duration simulatedStageDelay = Duration.ofMillis(200);

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public List<String> getCommand() {
        return command;
    }

    public void setCommand(List<String> command) {
        this.command = command;
    }

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public void setWorkingDirectory(String workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public void setEnvironment(Map<String, String> environment) {
        this.environment = environment;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public Duration getCompletedRetention() {
        return completedRetention;
    }

    public void setCompletedRetention(Duration completedRetention) {
        this.completedRetention = completedRetention;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public long getEvictionIntervalMs() {
        return evictionIntervalMs;
    }

    public void setEvictionIntervalMs(long evictionIntervalMs) {
        this.evictionIntervalMs = evictionIntervalMs;
    }

    public Duration getSimulatedStageDelay() {
        return simulatedStageDelay;
    }

    public void setSimulatedStageDelay(Duration simulatedStageDelay) {
        this.simulatedStageDelay = simulatedStageDelay;
    }
}
