package com.work.shield.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 账本连接配置。
 *
 * mode=mock: 使用 InMemoryLedgerClient
 * mode=web3j: 通过 RPC 读取合约事件与当前根
 */
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private String mode = "mock";

    private String rpcUrl = "http://localhost:8545";

    private String contractAddress;

    /**
     * 合约部署区块，读取承诺日志的起点
     */
    private long deploymentBlock = 0L;

    /**
     * 本地模拟模式：只在 mock 账本上生效，允许跳过输入承诺的安全校验
     */
    private boolean localSimulation = false;

    /**
     * 中继账户私钥，未配置时 web3j 账本只读
     */
    private String relayerPrivateKey;

    private long chainId = 31337L;

    private long gasLimit = 3_000_000L;

    private Duration receiptPollInterval = Duration.ofSeconds(2);

    private int receiptPollAttempts = 60;

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public void setContractAddress(String contractAddress) {
        this.contractAddress = contractAddress;
    }

    public long getDeploymentBlock() {
        return deploymentBlock;
    }

    public void setDeploymentBlock(long deploymentBlock) {
        this.deploymentBlock = deploymentBlock;
    }

    public boolean isLocalSimulation() {
        return localSimulation;
    }

    public void setLocalSimulation(boolean localSimulation) {
        this.localSimulation = localSimulation;
    }

    public String getRelayerPrivateKey() {
        return relayerPrivateKey;
    }

    public void setRelayerPrivateKey(String relayerPrivateKey) {
        this.relayerPrivateKey = relayerPrivateKey;
    }

    public long getChainId() {
        return chainId;
    }

    public void setChainId(long chainId) {
        this.chainId = chainId;
    }

    public long getGasLimit() {
        return gasLimit;
    }

    public void setGasLimit(long gasLimit) {
        this.gasLimit = gasLimit;
    }

    public Duration getReceiptPollInterval() {
        return receiptPollInterval;
    }

    public void setReceiptPollInterval(Duration receiptPollInterval) {
        this.receiptPollInterval = receiptPollInterval;
    }

    public int getReceiptPollAttempts() {
        return receiptPollAttempts;
    }

    public void setReceiptPollAttempts(int receiptPollAttempts) {
        this.receiptPollAttempts = receiptPollAttempts;
    }
}
