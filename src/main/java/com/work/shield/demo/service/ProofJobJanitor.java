package com.work.shield.demo.service;

import com.work.shield.core.ProofService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定期清理超过保留时长的终态证明任务。
 * 队列在每次 submit 时也会顺带清理，这里保证空闲时内存同样会回收。
 */
@Component
public class ProofJobJanitor {

    private static final Logger log = LoggerFactory.getLogger(ProofJobJanitor.class);

    private final ProofService proofService;

    public ProofJobJanitor(ProofService proofService) {
        this.proofService = proofService;
    }

    @Scheduled(fixedDelayString = "${prover.eviction-interval-ms:60000}")
    public void runOnce() {
        int evicted = proofService.evictExpired();
        if (evicted > 0) {
            log.info("proof job cleanup evicted count={}", evicted);
        }
    }
}
