package com.work.shield.demo.service;

import com.work.shield.core.ProofService;
import com.work.shield.core.chain.InMemoryLedgerClient;
import com.work.shield.core.chain.LedgerClient;
import com.work.shield.core.crypto.EcdsaWalletSigner;
import com.work.shield.core.crypto.NoteEncryptor;
import com.work.shield.core.exception.ValidationException;
import com.work.shield.core.merkle.OnChainMerkleAccumulator;
import com.work.shield.core.model.Wallet;
import com.work.shield.demo.config.LedgerProperties;
import com.work.shield.lattice.domain.Edge;
import com.work.shield.lattice.domain.Topologies;
import com.work.shield.lattice.domain.Topology;
import com.work.shield.lattice.scheduler.SchedulerOptions;
import com.work.shield.lattice.scheduler.SchedulerReport;
import com.work.shield.lattice.scheduler.TopologyScheduler;
import com.work.shield.lattice.scheduler.WalletFunder;
import com.work.shield.lattice.support.metrics.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 演示：在模拟账本上生成钱包、注资并运行一个拓扑。
 * <p>
 * 账本在多次运行之间共享，因此每次都以链上镜像树（同步账本日志）作为本地树，
 * 不能只用本次拓扑的钱包重建。
 * </p>
 */
@Service
public class LatticeDemoService {

    private static final Logger log = LoggerFactory.getLogger(LatticeDemoService.class);

    private final ProofService proofService;
    private final LedgerClient ledgerClient;
    private final NoteEncryptor noteEncryptor;
    private final SchedulerOptions schedulerOptions;
    private final LedgerProperties ledgerProperties;

    public LatticeDemoService(ProofService proofService,
                              LedgerClient ledgerClient,
                              NoteEncryptor noteEncryptor,
                              SchedulerOptions schedulerOptions,
                              LedgerProperties ledgerProperties) {
        this.proofService = proofService;
        this.ledgerClient = ledgerClient;
        this.noteEncryptor = noteEncryptor;
        this.schedulerOptions = schedulerOptions;
        this.ledgerProperties = ledgerProperties;
    }

    public SchedulerReport run(String topologyType, int walletCount, long amount) {
        if (!(ledgerClient instanceof InMemoryLedgerClient)) {
            throw new ValidationException("lattice demo requires ledger.mode=mock");
        }
        InMemoryLedgerClient ledger = (InMemoryLedgerClient) ledgerClient;
        String runId = UUID.randomUUID().toString().substring(0, 8);
        Topology topology = buildTopology(topologyType, runId, walletCount, amount);
        fundRootEdges(topology, new WalletFunder(ledger));

        OnChainMerkleAccumulator accumulator = new OnChainMerkleAccumulator(ledger, ledgerProperties.getDeploymentBlock());
        TopologyScheduler scheduler = new TopologyScheduler(topology, proofService, ledger, noteEncryptor, accumulator,
                new MetricsCollector(), schedulerOptions);
        log.info("lattice run started runId={} topology={} wallets={} edges={}", runId, topology.getName(),
                topology.getWallets().size(), topology.getEdges().size());
        return scheduler.execute();
    }

    private Topology buildTopology(String type, String runId, int walletCount, long amount) {
        if ("diamond".equals(type)) {
            return Topologies.diamond(wallets(runId, 4), amount * 2, amount * 2, amount, amount);
        }
        List<Wallet> wallets = wallets(runId, walletCount);
        switch (type) {
            case "chain":
                return Topologies.chain(wallets, amount);
            case "fan-out":
                return Topologies.fanOut(wallets.get(0), wallets.subList(1, wallets.size()), amount);
            case "fan-in":
                return Topologies.fanIn(wallets.subList(0, wallets.size() - 1), wallets.get(wallets.size() - 1),
                        amount);
            default:
                throw new ValidationException("unknown topology " + type);
        }
    }

    private static List<Wallet> wallets(String runId, int count) {
        List<Wallet> wallets = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String id = "w" + i;
            wallets.add(new Wallet(id, EcdsaWalletSigner.fromSeed(runId + "-" + id)));
        }
        return wallets;
    }

    /**
     * 没有依赖的边由发送方各自一笔存款支撑，互相不争用 UTXO；有依赖的边靠上游转入。
     */
    private static void fundRootEdges(Topology topology, WalletFunder funder) {
        for (Edge edge : topology.getEdges()) {
            if (edge.getDependsOn().isEmpty()) {
                funder.fund(topology.wallet(edge.getFrom()), edge.getAmount());
            }
        }
    }
}
