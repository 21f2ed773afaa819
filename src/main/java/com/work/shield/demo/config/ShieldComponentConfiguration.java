package com.work.shield.demo.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.shield.core.ProofService;
import com.work.shield.core.chain.InMemoryLedgerClient;
import com.work.shield.core.chain.LedgerClient;
import com.work.shield.core.config.ProofQueueConfig;
import com.work.shield.core.crypto.EciesNoteEncryptor;
import com.work.shield.core.crypto.NoteEncryptor;
import com.work.shield.core.prover.ProcessProver;
import com.work.shield.core.prover.Prover;
import com.work.shield.core.prover.SimulatedProver;
import com.work.shield.core.queue.ProofJobQueue;
import com.work.shield.core.security.SecurityVerifier;
import com.work.shield.lattice.scheduler.SchedulerOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;

/**
 * 将核心组件装配为 Spring Bean。
 * 账本默认使用内存模拟；ledger.mode=web3j 时由 {@link Web3jConfiguration} 提供实现。
 */
@Configuration
@EnableConfigurationProperties({ProverProperties.class, LedgerProperties.class, SchedulerProperties.class})
public class ShieldComponentConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "mock", matchIfMissing = true)
    public InMemoryLedgerClient inMemoryLedgerClient() {
        return new InMemoryLedgerClient();
    }

    @Bean
    @ConditionalOnMissingBean(Prover.class)
    public Prover prover(ProverProperties properties, LedgerProperties ledgerProperties, LedgerClient ledgerClient,
                         ObjectMapper objectMapper) {
        if ("process".equalsIgnoreCase(properties.getMode())) {
            File workingDirectory = properties.getWorkingDirectory() == null
                    ? null
                    : new File(properties.getWorkingDirectory());
            return new ProcessProver(properties.getCommand(), workingDirectory, properties.getEnvironment(),
                    objectMapper);
        }
        return new SimulatedProver(ledgerClient, ledgerProperties.getDeploymentBlock(),
                properties.getSimulatedStageDelay());
    }

    @Bean
    public ProofQueueConfig proofQueueConfig(ProverProperties properties) {
        return new ProofQueueConfig(
                properties.getMaxConcurrent(),
                properties.getCompletedRetention(),
                properties.getPollInterval()
        );
    }

    @Bean
    public ProofJobQueue proofJobQueue(Prover prover, ProofQueueConfig config) {
        return new ProofJobQueue(prover, config);
    }

    @Bean
    public SecurityVerifier securityVerifier(LedgerClient ledgerClient, LedgerProperties properties) {
        return new SecurityVerifier(ledgerClient, properties.getDeploymentBlock(), properties.isLocalSimulation());
    }

    @Bean
    public ProofService proofService(SecurityVerifier securityVerifier, ProofJobQueue proofJobQueue) {
        return new ProofService(securityVerifier, proofJobQueue);
    }

    @Bean
    @ConditionalOnMissingBean(NoteEncryptor.class)
    public NoteEncryptor noteEncryptor() {
        return new EciesNoteEncryptor();
    }

    /**
     * 模拟账本在多次演示运行间共享，调度器始终以同步账本日志的链上镜像树运行。
     */
    @Bean
    public SchedulerOptions schedulerOptions(SchedulerProperties properties) {
        return new SchedulerOptions(
                properties.getPollInterval(),
                properties.getMaxConcurrent(),
                properties.getProofTimeout(),
                properties.isVerifyBalances(),
                true
        );
    }
}
