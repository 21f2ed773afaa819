package com.work.shield.core.prover;

import com.work.shield.core.chain.CommitmentEvent;
import com.work.shield.core.chain.LedgerClient;
import com.work.shield.core.crypto.CommitmentScheme;
import com.work.shield.core.exception.ProverFailureException;
import com.work.shield.core.merkle.IncrementalMerkleTree;
import com.work.shield.core.merkle.MerkleHashing;
import com.work.shield.core.merkle.MerkleProof;
import com.work.shield.core.model.Note;
import com.work.shield.core.model.ProofRequest;
import com.work.shield.core.model.ProofResult;
import com.work.shield.core.model.PublicOutputs;
import com.work.shield.core.queue.JobStage;
import com.work.shield.core.support.ByteUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

import static com.work.shield.core.support.ValidationUtils.requireNonNegative;
import static com.work.shield.core.support.ValidationUtils.requireNonNull;

/**
 * 进程内模拟证明器（prover.mode=mock）。
 * <p>
 * 执行与电路相同的检查：输入 Merkle 证明对 oldRoot 有效、金额守恒、签名形状正确，
 * 并计算 nullifier、输出承诺与新根。新根 = 账本日志中根为 oldRoot 的前缀 + 本次输出。
 * 检查失败按电路断言处理，结果为 nonzero-exit:1。证明字节本身不具备密码学意义。
 * </p>
 */
public class SimulatedProver implements Prover, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SimulatedProver.class);

    private static final int SIGNATURE_LENGTH = 65;
    private static final byte[] PROOF_DOMAIN = "SIMULATED_PROOF_v1".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] VKEY_HASH = Hash.sha3("simulated-vkey-v1".getBytes(StandardCharsets.US_ASCII));

    private final LedgerClient ledger;
    private final long deploymentBlock;
    private final Duration stageDelay;
    private final ExecutorService executor;
    private final Map<ProverHandle, ProverExecution> executions = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public SimulatedProver(LedgerClient ledger, long deploymentBlock, Duration stageDelay) {
        this.ledger = requireNonNull(ledger, "ledger");
        this.deploymentBlock = requireNonNegative(deploymentBlock, "deploymentBlock");
        this.stageDelay = requireNonNull(stageDelay, "stageDelay");
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName("simulated-prover-" + t.getId());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newCachedThreadPool(tf);
    }

    @Override
    public ProverHandle submit(ProofRequest request) {
        requireNonNull(request, "request");
        ProverHandle handle = new ProverHandle("sim-" + sequence.incrementAndGet());
        ProverExecution execution = new ProverExecution();
        executions.put(handle, execution);
        executor.execute(() -> compute(handle, request, execution));
        return handle;
    }

    @Override
    public ProverStatus poll(ProverHandle handle) {
        ProverExecution execution = executions.get(handle);
        if (execution == null) {
            throw new ProverFailureException("unknown prover handle " + handle);
        }
        ProverStatus status = execution.snapshot();
        if (status.isTerminal()) {
            executions.remove(handle);
        }
        return status;
    }

    private void compute(ProverHandle handle, ProofRequest request, ProverExecution execution) {
        try {
            execution.progress(new ProgressEvent(JobStage.PREPARING, 20, "Precomputing nullifiers and commitments..."));
            pause();
            int inputs = request.getInputNotes().size();
            if (request.getInputProofs().size() != inputs || request.getInputIndices().size() != inputs
                    || request.getNullifierSignatures().size() != inputs || request.getTxSignatures().size() != inputs) {
                abort(handle, execution, "witness shape mismatch: inputs=" + inputs);
                return;
            }

            execution.progress(new ProgressEvent(JobStage.COMPUTING, 30, "Executing program..."));
            byte[] oldRoot = request.getOldRoot();
            long inputTotal = 0;
            List<byte[]> nullifiers = new ArrayList<>(inputs);
            for (int i = 0; i < inputs; i++) {
                Note note = request.getInputNotes().get(i);
                MerkleProof proof = request.getInputProofs().get(i);
                if (proof.getLeafIndex() != request.getInputIndices().get(i)
                        || !proof.verify(CommitmentScheme.commit(note), oldRoot)) {
                    abort(handle, execution, "Merkle proof failed for input note " + i);
                    return;
                }
                byte[] nullifierSignature = request.getNullifierSignatures().get(i);
                if (nullifierSignature.length != SIGNATURE_LENGTH || request.getTxSignatures().get(i).length != SIGNATURE_LENGTH) {
                    abort(handle, execution, "signature length mismatch for input note " + i);
                    return;
                }
                nullifiers.add(CommitmentScheme.nullifier(nullifierSignature));
                inputTotal += note.getAmount();
            }
            long outputTotal = 0;
            List<byte[]> outputCommitments = new ArrayList<>();
            for (Note note : request.getOutputNotes()) {
                outputCommitments.add(CommitmentScheme.commit(note));
                outputTotal += note.getAmount();
            }
            if (inputTotal != outputTotal) {
                abort(handle, execution, "value not conserved: inputs=" + inputTotal + " outputs=" + outputTotal);
                return;
            }

            execution.progress(new ProgressEvent(JobStage.PROVING, 50, "Generating ZK proof..."));
            pause();
            byte[] newRoot = newRoot(oldRoot, outputCommitments);
            if (newRoot == null) {
                abort(handle, execution, "old root " + ByteUtils.toHex(oldRoot) + " not found in ledger history");
                return;
            }

            execution.progress(new ProgressEvent(JobStage.SUBMITTING, 90, "Extracting public outputs..."));
            PublicOutputs outputs = new PublicOutputs(oldRoot, newRoot, nullifiers, outputCommitments);
            byte[] publicValues = PublicValuesCodec.encode(outputs);
            byte[] proof = Hash.sha3(ByteUtils.concat(PROOF_DOMAIN, publicValues));
            execution.succeed(new ProofResult(proof, publicValues, outputs, VKEY_HASH));
            log.info("simulated proof generated handle={} inputs={} outputs={} newRoot={}",
                    handle.getId(), inputs, outputCommitments.size(), ByteUtils.toHex(newRoot));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            execution.fail(ProverFailureReason.PROCESS_ERROR, "interrupted");
        } catch (RuntimeException e) {
            log.warn("simulated prover crashed handle={} err={}", handle.getId(), e.getMessage());
            execution.tail().append(String.valueOf(e));
            execution.fail(ProverFailureReason.PROCESS_ERROR, String.valueOf(e.getMessage()));
        }
    }

    /**
     * 按 leafIndex 重放账本日志，找到根等于 oldRoot 的前缀后追加输出。
     *
     * @return 新根；账本历史中不存在 oldRoot 时返回 null
     */
    private byte[] newRoot(byte[] oldRoot, List<byte[]> outputCommitments) {
        Map<Long, byte[]> byIndex = new TreeMap<>();
        for (CommitmentEvent event : ledger.readCommitmentLog(deploymentBlock)) {
            byIndex.putIfAbsent(event.getLeafIndex(), event.getCommitment());
        }
        List<byte[]> leaves = new ArrayList<>(byIndex.values());

        int prefix = -1;
        if (Arrays.equals(MerkleHashing.emptyRoot(), oldRoot)) {
            prefix = 0;
        } else {
            IncrementalMerkleTree replay = new IncrementalMerkleTree();
            for (int i = 0; i < leaves.size(); i++) {
                replay.insert(leaves.get(i));
                if (Arrays.equals(replay.root(), oldRoot)) {
                    prefix = i + 1;
                    break;
                }
            }
        }
        if (prefix < 0) {
            return null;
        }
        IncrementalMerkleTree tree = IncrementalMerkleTree.of(leaves.subList(0, prefix));
        for (byte[] commitment : outputCommitments) {
            tree.insert(commitment);
        }
        return tree.root();
    }

    private void abort(ProverHandle handle, ProverExecution execution, String assertion) {
        log.warn("simulated prover assertion failed handle={} reason={}", handle.getId(), assertion);
        execution.tail().append("panicked: " + assertion);
        execution.fail(ProverFailureReason.NONZERO_EXIT, "1");
    }

    private void pause() throws InterruptedException {
        if (!stageDelay.isZero() && !stageDelay.isNegative()) {
            Thread.sleep(stageDelay.toMillis());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
