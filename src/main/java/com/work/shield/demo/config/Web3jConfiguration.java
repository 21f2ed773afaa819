package com.work.shield.demo.config;

import com.work.shield.core.chain.LedgerClient;
import com.work.shield.demo.chain.web3j.Web3jLedgerClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * Web3j 装配：
 * 当 ledger.mode=web3j 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(LedgerProperties properties) {
        return Web3j.build(new HttpService(properties.getRpcUrl()));
    }

    @Bean
    public LedgerClient web3jLedgerClient(Web3j web3j, LedgerProperties properties) {
        if (properties.getContractAddress() == null || properties.getContractAddress().trim().isEmpty()) {
            throw new IllegalStateException("ledger.mode=web3j 需要配置 ledger.contract-address");
        }
        return new Web3jLedgerClient(web3j, properties.getContractAddress(), properties.getRelayerPrivateKey(),
                properties.getChainId(), properties.getGasLimit(), properties.getReceiptPollInterval(),
                properties.getReceiptPollAttempts());
    }
}
