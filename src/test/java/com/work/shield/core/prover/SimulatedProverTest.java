package com.work.shield.core.prover;

import com.work.shield.core.chain.InMemoryLedgerClient;
import com.work.shield.core.crypto.CommitmentScheme;
import com.work.shield.core.crypto.EcdsaWalletSigner;
import com.work.shield.core.crypto.EciesNoteEncryptor;
import com.work.shield.core.exception.ProverFailureException;
import com.work.shield.core.merkle.IncrementalMerkleTree;
import com.work.shield.core.model.Note;
import com.work.shield.core.model.ProofRequest;
import com.work.shield.core.model.PublicOutputs;
import com.work.shield.core.model.Utxo;
import com.work.shield.core.model.Wallet;
import com.work.shield.core.queue.JobStage;
import com.work.shield.core.tx.BuiltTransaction;
import com.work.shield.core.tx.TransactionBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class SimulatedProverTest {

    private InMemoryLedgerClient ledger;
    private IncrementalMerkleTree tree;
    private SimulatedProver prover;
    private Wallet alice;
    private Wallet bob;

    @BeforeEach
    public void setUp() {
        ledger = new InMemoryLedgerClient();
        tree = new IncrementalMerkleTree();
        prover = new SimulatedProver(ledger, 0L, Duration.ZERO);
        alice = new Wallet("alice", EcdsaWalletSigner.fromSeed("alice"));
        bob = new Wallet("bob", EcdsaWalletSigner.fromSeed("bob"));
        byte[] blinding = new byte[32];
        blinding[31] = 7;
        Note note = new Note(100L, alice.getOwnerKey(), blinding);
        byte[] commitment = CommitmentScheme.commit(note);
        long index = ledger.deposit("alice", 100L, commitment);
        tree.insert(commitment);
        alice.credit(new Utxo(note, commitment, index));
    }

    @AfterEach
    public void tearDown() {
        prover.close();
    }

    private ProverStatus await(ProverHandle handle) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        ProverStatus status = prover.poll(handle);
        while (!status.isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
            status = prover.poll(handle);
        }
        return status;
    }

    @Test
    public void valid_transfer_yields_public_outputs_matching_ledger_growth() throws Exception {
        BuiltTransaction tx = new TransactionBuilder(tree, new EciesNoteEncryptor()).build(alice, bob, 50L, tree.root());

        ProverStatus status = await(prover.submit(tx.getRequest()));

        assertEquals(JobStage.SUCCESS, status.getStage());
        PublicOutputs outputs = status.getResult().getPublicOutputs();
        assertArrayEquals(tree.root(), outputs.getOldRoot());
        assertEquals(1, outputs.getNullifiers().size());
        assertArrayEquals(CommitmentScheme.nullifier(tx.getRequest().getNullifierSignatures().get(0)),
                outputs.getNullifiers().get(0));
        assertEquals(2, outputs.getOutputCommitments().size());
        assertArrayEquals(tx.getOutputCommitments().get(0), outputs.getOutputCommitments().get(0));

        for (byte[] commitment : tx.getOutputCommitments()) {
            tree.insert(commitment);
        }
        assertArrayEquals(tree.root(), outputs.getNewRoot());
        assertArrayEquals(PublicValuesCodec.encode(outputs), status.getResult().getPublicValuesRaw());
    }

    @Test
    public void unbalanced_request_fails_like_circuit_assertion() throws Exception {
        BuiltTransaction tx = new TransactionBuilder(tree, new EciesNoteEncryptor()).build(alice, bob, 50L, tree.root());
        ProofRequest valid = tx.getRequest();
        Note inflated = new Note(90L, bob.getOwnerKey(), new byte[32]);
        ProofRequest request = new ProofRequest(valid.getInputNotes(), Arrays.asList(inflated, tx.getChangeNote()),
                valid.getNullifierSignatures(), valid.getTxSignatures(), valid.getInputIndices(),
                valid.getInputProofs(), valid.getOldRoot());

        ProverStatus status = await(prover.submit(request));

        assertEquals(JobStage.ERROR, status.getStage());
        assertEquals("nonzero-exit:1", status.getError());
        assertTrue(status.getDiagnosticTail().contains("panicked:"));
        assertNull(status.getResult());
    }

    @Test
    public void stale_merkle_proof_is_rejected() throws Exception {
        BuiltTransaction tx = new TransactionBuilder(tree, new EciesNoteEncryptor()).build(alice, bob, 50L, tree.root());
        ProofRequest valid = tx.getRequest();
        byte[] otherRoot = new byte[32];
        otherRoot[0] = 1;
        ProofRequest request = new ProofRequest(valid.getInputNotes(), valid.getOutputNotes(),
                valid.getNullifierSignatures(), valid.getTxSignatures(), valid.getInputIndices(),
                valid.getInputProofs(), otherRoot);

        ProverStatus status = await(prover.submit(request));

        assertEquals(JobStage.ERROR, status.getStage());
        assertTrue(status.getDiagnosticTail().contains("Merkle proof failed"));
    }

    @Test
    public void short_signature_is_rejected() throws Exception {
        BuiltTransaction tx = new TransactionBuilder(tree, new EciesNoteEncryptor()).build(alice, bob, 50L, tree.root());
        ProofRequest valid = tx.getRequest();
        ProofRequest request = new ProofRequest(valid.getInputNotes(), valid.getOutputNotes(),
                valid.getNullifierSignatures(), Collections.singletonList(new byte[64]), valid.getInputIndices(),
                valid.getInputProofs(), valid.getOldRoot());

        ProverStatus status = await(prover.submit(request));

        assertEquals("nonzero-exit:1", status.getError());
    }

    @Test
    public void terminal_status_is_handed_out_once() throws Exception {
        BuiltTransaction tx = new TransactionBuilder(tree, new EciesNoteEncryptor()).build(alice, bob, 50L, tree.root());
        ProverHandle handle = prover.submit(tx.getRequest());
        assertEquals(JobStage.SUCCESS, await(handle).getStage());

        assertThrows(ProverFailureException.class, () -> prover.poll(handle));
    }

    @Test
    public void unknown_handle_is_rejected() {
        assertThrows(ProverFailureException.class, () -> prover.poll(new ProverHandle("sim-404")));
    }
}
