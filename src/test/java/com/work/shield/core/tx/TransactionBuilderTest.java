package com.work.shield.core.tx;

import com.work.shield.core.chain.InMemoryLedgerClient;
import com.work.shield.core.crypto.CommitmentScheme;
import com.work.shield.core.crypto.EcdsaWalletSigner;
import com.work.shield.core.crypto.EciesNoteEncryptor;
import com.work.shield.core.exception.InsufficientFundsException;
import com.work.shield.core.merkle.IncrementalMerkleTree;
import com.work.shield.core.merkle.MerkleAccumulator;
import com.work.shield.core.model.Note;
import com.work.shield.core.model.ProofRequest;
import com.work.shield.core.model.Utxo;
import com.work.shield.core.model.Wallet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

public class TransactionBuilderTest {

    private final EciesNoteEncryptor encryptor = new EciesNoteEncryptor();
    private InMemoryLedgerClient ledger;
    private IncrementalMerkleTree tree;
    private Wallet alice;
    private Wallet bob;
    private EcdsaWalletSigner bobSigner;

    @BeforeEach
    public void setUp() {
        ledger = new InMemoryLedgerClient();
        tree = new IncrementalMerkleTree();
        alice = new Wallet("alice", EcdsaWalletSigner.fromSeed("alice"));
        bobSigner = EcdsaWalletSigner.fromSeed("bob");
        bob = new Wallet("bob", bobSigner);
    }

    private Utxo fund(Wallet wallet, long amount) {
        byte[] blinding = new byte[32];
        blinding[0] = (byte) (tree.leafCount() + 1);
        Note note = new Note(amount, wallet.getOwnerKey(), blinding);
        byte[] commitment = CommitmentScheme.commit(note);
        long index = ledger.deposit(wallet.getId(), amount, commitment);
        assertEquals(index, tree.insert(commitment));
        Utxo utxo = new Utxo(note, commitment, index);
        wallet.credit(utxo);
        return utxo;
    }

    @Test
    public void builds_recipient_and_change_outputs() {
        Utxo input = fund(alice, 100L);
        byte[] root = tree.root();

        BuiltTransaction tx = new TransactionBuilder(tree, encryptor).build(alice, bob, 50L, root);
        ProofRequest request = tx.getRequest();

        assertArrayEquals(root, request.getOldRoot());
        assertEquals(1, request.getInputNotes().size());
        assertEquals(Long.valueOf(input.getIndex()), request.getInputIndices().get(0));
        assertTrue(request.getInputProofs().get(0).verify(input.getCommitment(), root));
        assertEquals(65, request.getNullifierSignatures().get(0).length);
        assertEquals(65, request.getTxSignatures().get(0).length);

        assertEquals(2, request.getOutputNotes().size());
        assertEquals(50L, tx.getRecipientNote().getAmount());
        assertArrayEquals(bob.getOwnerKey(), tx.getRecipientNote().getOwnerPubkey());
        assertEquals(50L, tx.getChangeAmount());
        assertArrayEquals(alice.getOwnerKey(), tx.getChangeNote().getOwnerPubkey());
        assertArrayEquals(CommitmentScheme.commit(tx.getRecipientNote()), tx.getOutputCommitments().get(0));
        assertArrayEquals(CommitmentScheme.commit(tx.getChangeNote()), tx.getOutputCommitments().get(1));
    }

    @Test
    public void encrypted_outputs_are_bound_and_readable_by_recipient() {
        fund(alice, 100L);
        BuiltTransaction tx = new TransactionBuilder(tree, encryptor).build(alice, bob, 30L, tree.root());

        assertEquals(2, tx.getEncryptedOutputs().size());
        assertArrayEquals(tx.getOutputCommitments().get(0), tx.getEncryptedOutputs().get(0).getCommitment());
        assertArrayEquals(tx.getOutputCommitments().get(1), tx.getEncryptedOutputs().get(1).getCommitment());
        assertEquals(tx.getRecipientNote(), encryptor.decrypt(tx.getEncryptedOutputs().get(0), bobSigner.privateKey()));
    }

    @Test
    public void exact_amount_has_no_change_output() {
        fund(alice, 100L);
        BuiltTransaction tx = new TransactionBuilder(tree, encryptor).build(alice, bob, 100L, tree.root());

        assertNull(tx.getChangeNote());
        assertEquals(0L, tx.getChangeAmount());
        assertEquals(1, tx.getOutputCommitments().size());
        assertEquals(1, tx.getEncryptedOutputs().size());
    }

    @Test
    public void selected_inputs_stay_reserved_until_released() {
        fund(alice, 100L);
        BuiltTransaction tx = new TransactionBuilder(tree, encryptor).build(alice, bob, 10L, tree.root());

        assertThrows(InsufficientFundsException.class, () -> alice.selectUtxos(1L));
        alice.release(tx.getSelectedUtxos());
        assertEquals(1, alice.selectUtxos(1L).size());
    }

    @Test
    public void insufficient_funds_fail_before_building() {
        fund(alice, 40L);
        TransactionBuilder builder = new TransactionBuilder(tree, encryptor);
        assertThrows(InsufficientFundsException.class, () -> builder.build(alice, bob, 50L, tree.root()));
        assertEquals(1, alice.selectUtxos(40L).size());
    }

    @Test
    public void failure_after_selection_releases_inputs() {
        fund(alice, 100L);
        MerkleAccumulator broken = mock(MerkleAccumulator.class);
        when(broken.generateProof(anyLong())).thenThrow(new IllegalArgumentException("leaf index out of range"));

        TransactionBuilder builder = new TransactionBuilder(broken, encryptor);
        assertThrows(IllegalArgumentException.class, () -> builder.build(alice, bob, 50L, tree.root()));
        assertEquals(1, alice.selectUtxos(100L).size());
    }

    @Test
    public void multiple_inputs_each_get_a_proof() {
        fund(alice, 30L);
        fund(alice, 30L);
        BuiltTransaction tx = new TransactionBuilder(tree, encryptor).build(alice, bob, 50L, tree.root());

        assertEquals(2, tx.getRequest().getInputNotes().size());
        assertEquals(2, tx.getRequest().getInputProofs().size());
        assertEquals(10L, tx.getChangeAmount());
        assertFalse(Arrays.equals(tx.getRequest().getNullifierSignatures().get(0),
                tx.getRequest().getNullifierSignatures().get(1)));
    }
}
