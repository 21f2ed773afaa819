package com.work.shield.lattice.scheduler;

import com.work.shield.core.ProofService;
import com.work.shield.core.chain.LedgerClient;
import com.work.shield.core.chain.LedgerSubmission;
import com.work.shield.core.crypto.NoteEncryptor;
import com.work.shield.core.exception.AccumulatorSyncException;
import com.work.shield.core.exception.QueueLookupException;
import com.work.shield.core.merkle.IncrementalMerkleTree;
import com.work.shield.core.merkle.MerkleAccumulator;
import com.work.shield.core.merkle.OnChainMerkleAccumulator;
import com.work.shield.core.model.EncryptedOutput;
import com.work.shield.core.model.ProofResult;
import com.work.shield.core.model.Utxo;
import com.work.shield.core.model.Wallet;
import com.work.shield.core.queue.ProofJobView;
import com.work.shield.core.queue.SubmitReceipt;
import com.work.shield.core.support.ByteUtils;
import com.work.shield.core.tx.BuiltTransaction;
import com.work.shield.core.tx.TransactionBuilder;
import com.work.shield.lattice.balance.BalanceVerifier;
import com.work.shield.lattice.balance.BalanceViolation;
import com.work.shield.lattice.balance.EdgeBalanceVerification;
import com.work.shield.lattice.balance.FinalBalanceReport;
import com.work.shield.lattice.domain.Edge;
import com.work.shield.lattice.domain.EdgeSnapshot;
import com.work.shield.lattice.domain.EdgeState;
import com.work.shield.lattice.domain.Topology;
import com.work.shield.lattice.support.metrics.LatticeMetrics;
import com.work.shield.lattice.support.metrics.MetricsCollector;
import com.work.shield.lattice.support.metrics.MetricsSummary;
import com.work.shield.lattice.support.metrics.NoopLatticeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.locks.ReentrantLock;

import static com.work.shield.core.support.ValidationUtils.requireNonNull;

/**
 * 按依赖图驱动转账边：构建 → 证明 → 提交账本 → 确认。
 * <p>
 * 主循环每轮：并行启动不超过 maxConcurrent 的就绪边；轮询所有 PROVING 边；固定间隔休眠。
 * 树与钱包状态的读写都在 stateLock 内完成，任意时刻最多一个在途的状态变更。
 * 证明超时只由调用方判定：边被标记为 FAILED，队列中的 job 不会被取消。
 * </p>
 */
public class TopologyScheduler {

    private static final Logger log = LoggerFactory.getLogger(TopologyScheduler.class);

    private final Topology topology;
    private final ProofService proofService;
    private final LedgerClient ledger;
    private final NoteEncryptor encryptor;
    private final OnChainMerkleAccumulator onChainAccumulator;
    private final LatticeMetrics metrics;
    private final BalanceVerifier balanceVerifier;
    private final SchedulerOptions options;
    private final Clock clock;
    private final ReentrantLock stateLock = new ReentrantLock();

    private MerkleAccumulator accumulator;
    private TransactionBuilder builder;
    private byte[] currentRoot;
    private int rootMismatches;

    /**
     * 不采集指标，报告中的 metrics 为 null。
     */
    public TopologyScheduler(Topology topology, ProofService proofService, LedgerClient ledger,
                             NoteEncryptor encryptor, OnChainMerkleAccumulator onChainAccumulator,
                             SchedulerOptions options) {
        this(topology, proofService, ledger, encryptor, onChainAccumulator, new NoopLatticeMetrics(), options);
    }

    public TopologyScheduler(Topology topology, ProofService proofService, LedgerClient ledger,
                             NoteEncryptor encryptor, OnChainMerkleAccumulator onChainAccumulator,
                             LatticeMetrics metrics, SchedulerOptions options) {
        this(topology, proofService, ledger, encryptor, onChainAccumulator, metrics, new BalanceVerifier(), options,
                Clock.systemUTC());
    }

    public TopologyScheduler(Topology topology, ProofService proofService, LedgerClient ledger,
                             NoteEncryptor encryptor, OnChainMerkleAccumulator onChainAccumulator,
                             LatticeMetrics metrics, BalanceVerifier balanceVerifier, SchedulerOptions options,
                             Clock clock) {
        this.topology = requireNonNull(topology, "topology");
        this.proofService = requireNonNull(proofService, "proofService");
        this.ledger = requireNonNull(ledger, "ledger");
        this.encryptor = requireNonNull(encryptor, "encryptor");
        this.onChainAccumulator = onChainAccumulator;
        this.metrics = requireNonNull(metrics, "metrics");
        this.balanceVerifier = requireNonNull(balanceVerifier, "balanceVerifier");
        this.options = requireNonNull(options, "options");
        this.clock = requireNonNull(clock, "clock");
        if (options.isOnChainMode() && onChainAccumulator == null) {
            throw new IllegalArgumentException("onChainMode 需要提供 OnChainMerkleAccumulator");
        }
    }

    public SchedulerReport execute() {
        Instant begin = clock.instant();
        QueueMonitor monitor = new QueueMonitor(proofService, metrics, options.getPollInterval());
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName("edge-starter-" + t.getId());
            t.setDaemon(true);
            return t;
        };
        ExecutorService starters = Executors.newFixedThreadPool(options.getMaxConcurrent(), tf);
        monitor.start();
        try {
            initialize();
            log.info("topology execution started name={} edges={} wallets={} root={}", topology.getName(),
                    topology.getEdges().size(), topology.getWallets().size(), ByteUtils.toHex(currentRoot));
            runLoop(starters);
            SchedulerReport report = report(begin);
            log.info("topology execution finished name={} confirmed={} failed={} duration={}ms",
                    topology.getName(), report.getTopology().count(EdgeState.CONFIRMED),
                    report.getTopology().count(EdgeState.FAILED), report.getDuration().toMillis());
            return report;
        } finally {
            monitor.stop();
            starters.shutdownNow();
        }
    }

    private void initialize() {
        stateLock.lock();
        try {
            if (options.isOnChainMode()) {
                if (!onChainAccumulator.isSynced()) {
                    onChainAccumulator.sync();
                }
                OnChainMerkleAccumulator.RootCheck check = onChainAccumulator.verifyRoot();
                if (!check.matches()) {
                    throw new AccumulatorSyncException("Merkle root mismatch: local=" + check.getLocalRoot()
                            + " ledger=" + check.getLedgerRoot());
                }
                accumulator = onChainAccumulator;
                currentRoot = accumulator.root();
            } else {
                IncrementalMerkleTree tree = rebuildLocalTree();
                accumulator = tree;
                currentRoot = tree.root();
            }
            builder = new TransactionBuilder(accumulator, encryptor);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * 本地模式：按叶子编号重放所有钱包的 UTXO，编号缺口补零叶子。
     */
    private IncrementalMerkleTree rebuildLocalTree() {
        List<Utxo> all = new ArrayList<>();
        for (Wallet wallet : topology.getWallets()) {
            all.addAll(wallet.getUtxos());
        }
        all.sort(Comparator.comparingLong(Utxo::getIndex));
        IncrementalMerkleTree tree = new IncrementalMerkleTree();
        for (Utxo utxo : all) {
            while (tree.leafCount() < utxo.getIndex()) {
                log.warn("local tree gap at leafIndex={}, filling with zero leaf", tree.leafCount());
                tree.insert(ByteUtils.zero());
            }
            tree.insert(utxo.getCommitment());
        }
        log.info("local merkle tree rebuilt leaves={} root={}", tree.leafCount(), ByteUtils.toHex(tree.root()));
        return tree;
    }

    private void runLoop(ExecutorService starters) {
        while (!topology.isComplete()) {
            int started = startReadyEdges(starters);
            pollInFlight();
            if (topology.isComplete()) {
                break;
            }
            if (started == 0 && topology.inFlightCount() == 0 && topology.readyEdges().isEmpty()) {
                for (Edge stalled : topology.edgesIn(EdgeState.READY)) {
                    failEdge(stalled, ErrorTypes.DEPENDENCY_FAILED, "unschedulable");
                }
                break;
            }
            sleep(options.getPollInterval());
        }
    }

    private int startReadyEdges(ExecutorService starters) {
        int slots = options.getMaxConcurrent() - topology.inFlightCount();
        List<Edge> ready = topology.readyEdges();
        if (slots <= 0 || ready.isEmpty()) {
            return 0;
        }
        List<Edge> batch = ready.subList(0, Math.min(slots, ready.size()));
        List<Callable<Void>> tasks = new ArrayList<>(batch.size());
        for (Edge edge : batch) {
            tasks.add(() -> {
                startEdge(edge);
                return null;
            });
        }
        try {
            starters.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("scheduler interrupted while starting edges", e);
        }
        return batch.size();
    }

    private void startEdge(Edge edge) {
        try {
            edge.transition(EdgeState.PROVING, clock.instant());
            Wallet from = topology.wallet(edge.getFrom());
            Wallet to = topology.wallet(edge.getTo());
            if (from == null || to == null) {
                failEdge(edge, ErrorTypes.WALLET_NOT_FOUND,
                        "wallet not found: " + (from == null ? edge.getFrom() : edge.getTo()));
                return;
            }

            BuiltTransaction built;
            stateLock.lock();
            try {
                built = builder.build(from, to, edge.getAmount(), currentRoot);
            } finally {
                stateLock.unlock();
            }
            edge.setTransaction(built);

            SubmitReceipt receipt = proofService.submit(built.getRequest());
            edge.assignJob(receipt.getJobId(), receipt.getQueuePosition());
            metrics.proofSubmitted(edge.getId(), receipt.getJobId(), receipt.getQueuePosition());
            log.info("edge started edge={} jobId={} queuePosition={}", edge.getId(), receipt.getJobId(),
                    receipt.getQueuePosition());
        } catch (RuntimeException e) {
            failEdge(edge, ErrorTypes.PROOF_SUBMISSION, e.getMessage());
        }
    }

    private void pollInFlight() {
        for (Edge edge : topology.edgesIn(EdgeState.PROVING)) {
            if (edge.getJobId() != null) {
                pollEdge(edge);
            }
        }
    }

    private void pollEdge(Edge edge) {
        ProofJobView view;
        try {
            view = proofService.status(edge.getJobId());
        } catch (QueueLookupException e) {
            failEdge(edge, ErrorTypes.PROOF_POLL, e.getMessage());
            return;
        } catch (RuntimeException e) {
            // 轮询失败不影响边状态，下一轮重试
            metrics.error(edge.getId(), ErrorTypes.PROOF_POLL, e.getMessage());
            log.warn("proof status poll failed edge={} jobId={} err={}", edge.getId(), edge.getJobId(), e.getMessage());
            return;
        }

        switch (view.getStage()) {
            case SUCCESS:
                onProofSuccess(edge, view.getResult());
                break;
            case ERROR:
                failEdge(edge, ErrorTypes.PROOF_GENERATION, view.getError());
                break;
            default:
                Duration elapsed = Duration.between(edge.getStartTime(), clock.instant());
                if (elapsed.compareTo(options.getProofTimeout()) > 0) {
                    failEdge(edge, ErrorTypes.PROOF_TIMEOUT, "proof-timeout");
                }
        }
    }

    private void onProofSuccess(Edge edge, ProofResult result) {
        Instant now = clock.instant();
        edge.markProofComplete(now);
        metrics.proofCompleted(edge.getId(), edge.proofDuration());
        edge.transition(EdgeState.SUBMITTED, now);

        BuiltTransaction tx = edge.getTransaction();
        List<byte[]> proven = result.getPublicOutputs().getOutputCommitments();
        if (!sameCommitments(proven, tx.getOutputCommitments())) {
            failEdge(edge, ErrorTypes.PROOF_GENERATION, "proven output commitments do not match built outputs");
            return;
        }
        List<EncryptedOutput> bound = new ArrayList<>(proven.size());
        for (int i = 0; i < proven.size(); i++) {
            bound.add(tx.getEncryptedOutputs().get(i).withCommitment(proven.get(i)));
        }

        String txHash;
        try {
            txHash = ledger.submitTransaction(new LedgerSubmission(bound, result.getProof(), result.getPublicValuesRaw()));
        } catch (RuntimeException e) {
            failEdge(edge, ErrorTypes.RELAYER_SUBMISSION, e.getMessage());
            return;
        }
        edge.setTxHash(txHash);

        stateLock.lock();
        try {
            edge.transition(EdgeState.CONFIRMED, clock.instant());
            applyConfirmed(edge, tx, result);
            if (options.isVerifyBalances()) {
                EdgeBalanceVerification verification = balanceVerifier.verifyEdge(edge,
                        topology.wallet(edge.getFrom()), topology.wallet(edge.getTo()));
                for (BalanceViolation violation : verification.getViolations()) {
                    metrics.error(edge.getId(), violation.getType().getCode(), violation.toString());
                }
            }
        } finally {
            stateLock.unlock();
        }
        metrics.txConfirmed(edge.getId(), edge.totalDuration());
        log.info("edge confirmed edge={} txHash={} root={}", edge.getId(), txHash, ByteUtils.toHex(currentRoot));
    }

    /**
     * 确认后的状态更新：花掉输入，按 [接收方, 找零] 顺序插入输出并分配叶子编号，当前根推进到证明报告的新根。
     * 仅链上模式比对影子树根：不一致时只告警，并以与账本同步的影子树为准继续。
     */
    private void applyConfirmed(Edge edge, BuiltTransaction tx, ProofResult result) {
        Wallet from = topology.wallet(edge.getFrom());
        Wallet to = topology.wallet(edge.getTo());
        from.spend(tx.getSelectedUtxos());

        List<byte[]> commitments = tx.getOutputCommitments();
        long recipientIndex = accumulator.insert(commitments.get(0));
        to.credit(new Utxo(tx.getRecipientNote(), commitments.get(0), recipientIndex));
        if (tx.getChangeNote() != null) {
            long changeIndex = accumulator.insert(commitments.get(1));
            from.credit(new Utxo(tx.getChangeNote(), commitments.get(1), changeIndex));
        }

        byte[] provenRoot = result.getPublicOutputs().getNewRoot();
        currentRoot = provenRoot;
        if (!options.isOnChainMode()) {
            return;
        }
        byte[] shadowRoot = accumulator.root();
        if (!Arrays.equals(shadowRoot, provenRoot)) {
            rootMismatches++;
            String message = "shadow root " + ByteUtils.toHex(shadowRoot) + " differs from proof newRoot "
                    + ByteUtils.toHex(provenRoot);
            log.warn("root mismatch after confirmation edge={} {}", edge.getId(), message);
            metrics.error(edge.getId(), ErrorTypes.ROOT_MISMATCH, message);
            currentRoot = shadowRoot;
        }
    }

    private void failEdge(Edge edge, String type, String reason) {
        stateLock.lock();
        try {
            if (edge.getState().isTerminal()) {
                return;
            }
            Instant now = clock.instant();
            edge.fail(reason, now);
            BuiltTransaction tx = edge.getTransaction();
            Wallet from = topology.wallet(edge.getFrom());
            if (tx != null && from != null) {
                from.release(tx.getSelectedUtxos());
            }
            metrics.error(edge.getId(), type, reason);
            log.warn("edge failed edge={} type={} reason={}", edge.getId(), type, reason);
            for (Edge dependent : topology.failDependents(edge, now)) {
                metrics.error(dependent.getId(), ErrorTypes.DEPENDENCY_FAILED, dependent.getError());
                log.warn("edge failed edge={} type={} reason={}", dependent.getId(),
                        ErrorTypes.DEPENDENCY_FAILED, dependent.getError());
            }
        } finally {
            stateLock.unlock();
        }
    }

    private SchedulerReport report(Instant begin) {
        FinalBalanceReport finalBalances = options.isVerifyBalances()
                ? balanceVerifier.verifyFinal(topology.getWallets())
                : null;
        MetricsSummary summary = metrics instanceof MetricsCollector ? ((MetricsCollector) metrics).summary() : null;
        List<EdgeSnapshot> snapshots = new ArrayList<>();
        for (Edge edge : topology.getEdges()) {
            snapshots.add(edge.snapshot());
        }
        return new SchedulerReport(Duration.between(begin, clock.instant()), snapshots, topology.summary(), summary,
                balanceVerifier.getEdgeVerifications(), finalBalances, balanceVerifier.summary(), rootMismatches);
    }

    private static boolean sameCommitments(List<byte[]> left, List<byte[]> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!Arrays.equals(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static void sleep(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("scheduler interrupted", e);
        }
    }

    public byte[] getCurrentRoot() {
        stateLock.lock();
        try {
            return currentRoot == null ? null : currentRoot.clone();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * @return 本次运行使用的累加器；execute 之前为 null
     */
    public MerkleAccumulator getAccumulator() {
        return accumulator;
    }
}
