package com.work.shield.lattice.scheduler;

import com.work.shield.core.ProofService;
import com.work.shield.core.chain.InMemoryLedgerClient;
import com.work.shield.core.chain.LedgerSubmission;
import com.work.shield.core.config.ProofQueueConfig;
import com.work.shield.core.crypto.EcdsaWalletSigner;
import com.work.shield.core.crypto.EciesNoteEncryptor;
import com.work.shield.core.exception.RelayerFailureException;
import com.work.shield.core.merkle.OnChainMerkleAccumulator;
import com.work.shield.core.model.ProofRequest;
import com.work.shield.core.model.ProofResult;
import com.work.shield.core.model.PublicOutputs;
import com.work.shield.core.model.Wallet;
import com.work.shield.core.prover.SimulatedProver;
import com.work.shield.core.queue.JobStage;
import com.work.shield.core.queue.ProofJobQueue;
import com.work.shield.core.queue.ProofJobView;
import com.work.shield.core.queue.QueueStatus;
import com.work.shield.core.queue.SubmitReceipt;
import com.work.shield.core.security.SecurityVerifier;
import com.work.shield.lattice.domain.Edge;
import com.work.shield.lattice.domain.EdgeSnapshot;
import com.work.shield.lattice.domain.EdgeState;
import com.work.shield.lattice.domain.Topologies;
import com.work.shield.lattice.domain.Topology;
import com.work.shield.lattice.support.metrics.MetricsCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class TopologySchedulerTest {

    private InMemoryLedgerClient ledger;
    private SimulatedProver prover;
    private ProofJobQueue queue;
    private ProofService proofService;
    private WalletFunder funder;
    private MetricsCollector metrics;

    @BeforeEach
    public void setUp() {
        ledger = new InMemoryLedgerClient();
        prover = new SimulatedProver(ledger, 0L, Duration.ZERO);
        queue = new ProofJobQueue(prover, new ProofQueueConfig(1, Duration.ofMinutes(10), Duration.ofMillis(5)));
        proofService = new ProofService(new SecurityVerifier(ledger, 0L), queue);
        funder = new WalletFunder(ledger);
        metrics = new MetricsCollector();
    }

    @AfterEach
    public void tearDown() {
        queue.close();
        prover.close();
    }

    private static Wallet wallet(String id) {
        return new Wallet(id, EcdsaWalletSigner.fromSeed("scheduler-" + id));
    }

    private static SchedulerOptions options(int maxConcurrent, Duration proofTimeout, boolean onChainMode) {
        return new SchedulerOptions(Duration.ofMillis(10), maxConcurrent, proofTimeout, true, onChainMode);
    }

    private TopologyScheduler onChain(Topology topology, int maxConcurrent) {
        return new TopologyScheduler(topology, proofService, ledger, new EciesNoteEncryptor(),
                new OnChainMerkleAccumulator(ledger, 0L), metrics, options(maxConcurrent, Duration.ofSeconds(30), true));
    }

    @Test
    public void single_transfer_confirms_and_grows_ledger_by_two_leaves() {
        Wallet alice = wallet("alice");
        Wallet bob = wallet("bob");
        funder.fund(alice, 100L);
        Topology topology = new Topology("single").addWallet(alice).addWallet(bob);
        topology.addEdge("alice->bob", "alice", "bob", 50L);

        TopologyScheduler scheduler = onChain(topology, 1);
        SchedulerReport report = scheduler.execute();

        EdgeSnapshot edge = report.edge("alice->bob");
        assertEquals(EdgeState.CONFIRMED, edge.getState());
        assertNotNull(edge.getTxHash());
        assertNotNull(edge.getJobId());
        assertEquals(3L, ledger.leafCount());
        assertEquals(50L, alice.getBalance());
        assertEquals(50L, bob.getBalance());
        assertEquals(1L, bob.getUtxos().get(0).getIndex());
        assertArrayEquals(ledger.currentRoot(), scheduler.getCurrentRoot());
        assertEquals(0, report.getRootMismatches());
        assertEquals(1, report.getMetrics().getTxConfirmed());
        assertTrue(report.getBalanceSummary().isAllValid());
        assertTrue(report.getFinalBalances().isAllMatch());
    }

    @Test
    public void chain_runs_edges_in_dependency_order_in_local_mode() {
        List<Wallet> wallets = Arrays.asList(wallet("w0"), wallet("w1"), wallet("w2"));
        funder.fund(wallets.get(0), 100L);
        Topology topology = Topologies.chain(wallets, 30L);

        TopologyScheduler scheduler = new TopologyScheduler(topology, proofService, ledger, new EciesNoteEncryptor(),
                null, metrics, options(4, Duration.ofSeconds(30), false));
        SchedulerReport report = scheduler.execute();

        assertEquals(2, report.getTopology().count(EdgeState.CONFIRMED));
        List<Edge.StateChange> first = report.edge("chain-0").getHistory();
        Instant firstConfirmed = first.get(first.size() - 1).getAt();
        Instant secondStarted = report.edge("chain-1").getHistory().get(0).getAt();
        assertFalse(secondStarted.isBefore(firstConfirmed));

        assertEquals(70L, wallets.get(0).getBalance());
        assertEquals(0L, wallets.get(1).getBalance());
        assertEquals(30L, wallets.get(2).getBalance());
        // 1 deposit + (recipient, change) + recipient only
        assertEquals(4L, ledger.leafCount());
        assertArrayEquals(ledger.currentRoot(), scheduler.getCurrentRoot());
    }

    @Test
    public void concurrent_edges_on_same_root_reanchor_to_shadow_tree() {
        Wallet source = wallet("src");
        Wallet a = wallet("a");
        Wallet b = wallet("b");
        funder.fund(source, 100L);
        funder.fund(source, 100L);
        Topology topology = Topologies.fanOut(source, Arrays.asList(a, b), 40L);

        TopologyScheduler scheduler = onChain(topology, 2);
        SchedulerReport report = scheduler.execute();

        assertEquals(2, report.getTopology().count(EdgeState.CONFIRMED));
        assertEquals(1, report.getRootMismatches());
        assertEquals(1, metrics.errorCount(ErrorTypes.ROOT_MISMATCH));
        assertEquals(6L, ledger.leafCount());
        assertArrayEquals(ledger.currentRoot(), scheduler.getCurrentRoot());
        assertArrayEquals(ledger.currentRoot(), scheduler.getAccumulator().root());
        assertEquals(120L, source.getBalance());
    }

    @Test
    public void local_mode_advances_to_proven_root_without_shadow_comparison() {
        Wallet source = wallet("src");
        Wallet a = wallet("a");
        Wallet b = wallet("b");
        funder.fund(source, 100L);
        funder.fund(source, 100L);
        Topology topology = Topologies.fanOut(source, Arrays.asList(a, b), 40L);

        TopologyScheduler scheduler = new TopologyScheduler(topology, proofService, ledger, new EciesNoteEncryptor(),
                null, metrics, options(2, Duration.ofSeconds(30), false));
        SchedulerReport report = scheduler.execute();

        assertEquals(2, report.getTopology().count(EdgeState.CONFIRMED));
        assertEquals(0, report.getRootMismatches());
        assertEquals(0, metrics.errorCount(ErrorTypes.ROOT_MISMATCH));
        assertEquals(6L, ledger.leafCount());
        // 两条边基于同一个旧根证明，后确认的一条报告的新根不是账本当前根
        assertFalse(Arrays.equals(ledger.currentRoot(), scheduler.getCurrentRoot()));
        assertArrayEquals(ledger.currentRoot(), scheduler.getAccumulator().root());
    }

    @Test
    public void relayer_rejection_fails_only_owning_edge() {
        InMemoryLedgerClient rejecting = spy(new InMemoryLedgerClient());
        doThrow(new RelayerFailureException("nullifier already spent"))
                .doCallRealMethod()
                .when(rejecting).submitTransaction(any(LedgerSubmission.class));
        SimulatedProver rejectingProver = new SimulatedProver(rejecting, 0L, Duration.ZERO);
        ProofJobQueue rejectingQueue = new ProofJobQueue(rejectingProver,
                new ProofQueueConfig(1, Duration.ofMinutes(10), Duration.ofMillis(5)));
        try {
            ProofService service = new ProofService(new SecurityVerifier(rejecting, 0L), rejectingQueue);
            Wallet source = wallet("src");
            Wallet a = wallet("a");
            Wallet b = wallet("b");
            WalletFunder rejectingFunder = new WalletFunder(rejecting);
            rejectingFunder.fund(source, 100L);
            rejectingFunder.fund(source, 100L);
            byte[] rootBefore = rejecting.currentRoot();
            Topology topology = Topologies.fanOut(source, Arrays.asList(a, b), 40L);

            TopologyScheduler scheduler = new TopologyScheduler(topology, service, rejecting,
                    new EciesNoteEncryptor(), new OnChainMerkleAccumulator(rejecting, 0L), metrics,
                    options(1, Duration.ofSeconds(30), true));
            SchedulerReport report = scheduler.execute();

            EdgeSnapshot failed = report.edge("fanout-0");
            assertEquals(EdgeState.FAILED, failed.getState());
            assertEquals("nullifier already spent", failed.getError());
            assertNull(failed.getTxHash());
            assertEquals(1, metrics.errorCount(ErrorTypes.RELAYER_SUBMISSION));
            assertEquals(EdgeState.CONFIRMED, report.edge("fanout-1").getState());

            // 被拒的边没有改动树和钱包：只有 2 笔存款和兄弟边的两个输出
            assertEquals(4L, rejecting.leafCount());
            assertEquals(4L, scheduler.getAccumulator().leafCount());
            assertFalse(Arrays.equals(rootBefore, scheduler.getCurrentRoot()));
            assertArrayEquals(rejecting.currentRoot(), scheduler.getCurrentRoot());
            assertEquals(0, report.getRootMismatches());
            assertEquals(0L, a.getBalance());
            assertEquals(40L, b.getBalance());
            assertEquals(160L, source.getBalance());
            // 被拒边预留的输入已释放，可再次选中
            assertEquals(2, source.selectUtxos(160L).size());
        } finally {
            rejectingQueue.close();
            rejectingProver.close();
        }
    }

    @Test
    public void failed_edge_cascades_to_dependents() {
        List<Wallet> wallets = Arrays.asList(wallet("w0"), wallet("w1"), wallet("w2"));
        funder.fund(wallets.get(0), 10L);
        Topology topology = Topologies.chain(wallets, 30L);

        SchedulerReport report = onChain(topology, 2).execute();

        assertEquals(EdgeState.FAILED, report.edge("chain-0").getState());
        assertEquals("dependency-failed:chain-0", report.edge("chain-1").getError());
        assertEquals(1, metrics.errorCount(ErrorTypes.PROOF_SUBMISSION));
        assertEquals(1, metrics.errorCount(ErrorTypes.DEPENDENCY_FAILED));
        assertEquals(1L, ledger.leafCount());
        assertEquals(10L, wallets.get(0).getBalance());
    }

    @Test
    public void missing_wallet_fails_edge() {
        Wallet alice = wallet("alice");
        funder.fund(alice, 100L);
        Topology topology = new Topology("ghost").addWallet(alice);
        topology.addEdge("alice->ghost", "alice", "ghost", 10L);

        SchedulerReport report = onChain(topology, 1).execute();

        assertEquals(EdgeState.FAILED, report.edge("alice->ghost").getState());
        assertEquals("wallet not found: ghost", report.edge("alice->ghost").getError());
        assertEquals(1, metrics.errorCount(ErrorTypes.WALLET_NOT_FOUND));
    }

    @Test
    public void stuck_proof_times_out_and_releases_inputs() {
        Wallet alice = wallet("alice");
        Wallet bob = wallet("bob");
        funder.fund(alice, 100L);
        Topology topology = new Topology("stuck").addWallet(alice).addWallet(bob);
        topology.addEdge("alice->bob", "alice", "bob", 50L);

        ProofService stuck = mock(ProofService.class);
        when(stuck.submit(any(ProofRequest.class))).thenReturn(new SubmitReceipt("job-1", 0, 1, 0));
        when(stuck.status(anyString())).thenReturn(view(JobStage.PROVING, null, null));
        when(stuck.queueStatus()).thenReturn(emptyQueue());

        TopologyScheduler scheduler = new TopologyScheduler(topology, stuck, ledger, new EciesNoteEncryptor(),
                null, metrics, options(1, Duration.ofMillis(50), false));
        SchedulerReport report = scheduler.execute();

        EdgeSnapshot edge = report.edge("alice->bob");
        assertEquals(EdgeState.FAILED, edge.getState());
        assertEquals("proof-timeout", edge.getError());
        assertEquals(1, metrics.errorCount(ErrorTypes.PROOF_TIMEOUT));
        assertEquals(1, alice.selectUtxos(100L).size());
        assertEquals(1L, ledger.leafCount());
    }

    @Test
    public void prover_error_fails_edge_with_prover_reason() {
        Wallet alice = wallet("alice");
        Wallet bob = wallet("bob");
        funder.fund(alice, 100L);
        Topology topology = new Topology("broken").addWallet(alice).addWallet(bob);
        topology.addEdge("alice->bob", "alice", "bob", 50L);

        ProofService failing = mock(ProofService.class);
        when(failing.submit(any(ProofRequest.class))).thenReturn(new SubmitReceipt("job-1", 0, 1, 0));
        when(failing.status("job-1")).thenReturn(view(JobStage.ERROR, null, "nonzero-exit:1"));
        when(failing.queueStatus()).thenReturn(emptyQueue());

        SchedulerReport report = new TopologyScheduler(topology, failing, ledger, new EciesNoteEncryptor(),
                null, metrics, options(1, Duration.ofSeconds(30), false)).execute();

        assertEquals("nonzero-exit:1", report.edge("alice->bob").getError());
        assertEquals(1, metrics.errorCount(ErrorTypes.PROOF_GENERATION));
        assertEquals(100L, alice.getBalance());
    }

    @Test
    public void proof_with_foreign_outputs_is_never_submitted() {
        Wallet alice = wallet("alice");
        Wallet bob = wallet("bob");
        funder.fund(alice, 100L);
        Topology topology = new Topology("foreign").addWallet(alice).addWallet(bob);
        topology.addEdge("alice->bob", "alice", "bob", 50L);

        PublicOutputs outputs = new PublicOutputs(new byte[32], new byte[32],
                Collections.singletonList(new byte[32]), Collections.singletonList(new byte[32]));
        ProofResult result = new ProofResult(new byte[]{1}, new byte[]{2}, outputs, null);
        ProofService forged = mock(ProofService.class);
        when(forged.submit(any(ProofRequest.class))).thenReturn(new SubmitReceipt("job-1", 0, 1, 0));
        when(forged.status("job-1")).thenReturn(view(JobStage.SUCCESS, result, null));
        when(forged.queueStatus()).thenReturn(emptyQueue());

        SchedulerReport report = new TopologyScheduler(topology, forged, ledger, new EciesNoteEncryptor(),
                null, metrics, options(1, Duration.ofSeconds(30), false)).execute();

        assertEquals(EdgeState.FAILED, report.edge("alice->bob").getState());
        assertEquals(1L, ledger.leafCount());
        assertEquals(1, metrics.errorCount(ErrorTypes.PROOF_GENERATION));
    }

    @Test
    public void runs_without_metrics_collector() {
        Wallet alice = wallet("alice");
        Wallet bob = wallet("bob");
        funder.fund(alice, 100L);
        Topology topology = new Topology("quiet").addWallet(alice).addWallet(bob);
        topology.addEdge("alice->bob", "alice", "bob", 100L);

        SchedulerReport report = new TopologyScheduler(topology, proofService, ledger, new EciesNoteEncryptor(),
                new OnChainMerkleAccumulator(ledger, 0L), options(1, Duration.ofSeconds(30), true)).execute();

        assertEquals(EdgeState.CONFIRMED, report.edge("alice->bob").getState());
        assertNull(report.getMetrics());
        assertEquals(2L, ledger.leafCount());
        assertEquals(100L, bob.getBalance());
    }

    @Test
    public void on_chain_mode_requires_accumulator() {
        Topology topology = new Topology("empty");
        assertThrows(IllegalArgumentException.class, () -> new TopologyScheduler(topology, proofService, ledger,
                new EciesNoteEncryptor(), null, metrics, options(1, Duration.ofSeconds(1), true)));
    }

    private static ProofJobView view(JobStage stage, ProofResult result, String error) {
        Instant now = Instant.now();
        return new ProofJobView("job-1", stage, stage.wireName(), 50, 0, now, now,
                stage.isTerminal() ? now : null, result, error, null);
    }

    private static QueueStatus emptyQueue() {
        return new QueueStatus(0, 0, 1, 0, Collections.<String>emptyList(), Collections.<String>emptyList());
    }
}
