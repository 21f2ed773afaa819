package com.work.shield.core.merkle;

import com.work.shield.core.chain.CommitmentEvent;
import com.work.shield.core.chain.LedgerClient;
import com.work.shield.core.exception.AccumulatorSyncException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.work.shield.core.merkle.IncrementalMerkleTreeTest.leaf;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

public class OnChainMerkleAccumulatorTest {

    private static CommitmentEvent event(CommitmentEvent.Kind kind, byte[] commitment, long leafIndex, long block) {
        return new CommitmentEvent(kind, commitment, leafIndex, block, 0);
    }

    @Test
    public void sync_orders_by_leaf_index_and_drops_duplicates() {
        LedgerClient ledger = mock(LedgerClient.class);
        when(ledger.readCommitmentLog(5L)).thenReturn(Arrays.asList(
                event(CommitmentEvent.Kind.OUTPUT, leaf(3), 2, 9),
                event(CommitmentEvent.Kind.DEPOSIT, leaf(1), 0, 6),
                event(CommitmentEvent.Kind.DEPOSIT, leaf(2), 1, 7),
                event(CommitmentEvent.Kind.OUTPUT, leaf(9), 1, 8)));
        byte[] expected = IncrementalMerkleTree.of(Arrays.asList(leaf(1), leaf(2), leaf(3))).root();
        when(ledger.currentRoot()).thenReturn(expected);

        OnChainMerkleAccumulator accumulator = new OnChainMerkleAccumulator(ledger, 5L);
        accumulator.sync();

        assertTrue(accumulator.isSynced());
        assertEquals(3L, accumulator.leafCount());
        assertArrayEquals(expected, accumulator.root());
        assertEquals(1L, accumulator.indexOf(leaf(2)));
        assertEquals(-1L, accumulator.indexOf(leaf(9)));
        assertTrue(accumulator.generateProof(2).verify(leaf(3), expected));
    }

    @Test
    public void sync_fills_gaps_with_zero_leaves() {
        LedgerClient ledger = mock(LedgerClient.class);
        when(ledger.readCommitmentLog(0L)).thenReturn(Arrays.asList(
                event(CommitmentEvent.Kind.DEPOSIT, leaf(1), 0, 1),
                event(CommitmentEvent.Kind.OUTPUT, leaf(3), 2, 2)));
        byte[] expected = IncrementalMerkleTree.of(Arrays.asList(leaf(1), new byte[32], leaf(3))).root();
        when(ledger.currentRoot()).thenReturn(expected);

        OnChainMerkleAccumulator accumulator = new OnChainMerkleAccumulator(ledger, 0L);
        accumulator.sync();

        assertEquals(3L, accumulator.leafCount());
        assertEquals(2L, accumulator.indexOf(leaf(3)));
    }

    @Test
    public void root_mismatch_after_sync_is_fatal() {
        LedgerClient ledger = mock(LedgerClient.class);
        when(ledger.readCommitmentLog(anyLong())).thenReturn(
                Collections.singletonList(event(CommitmentEvent.Kind.DEPOSIT, leaf(1), 0, 1)));
        when(ledger.currentRoot()).thenReturn(leaf(42));

        OnChainMerkleAccumulator accumulator = new OnChainMerkleAccumulator(ledger, 0L);

        assertThrows(AccumulatorSyncException.class, accumulator::sync);
        assertFalse(accumulator.isSynced());
    }

    @Test
    public void empty_log_syncs_to_empty_root() {
        LedgerClient ledger = mock(LedgerClient.class);
        when(ledger.readCommitmentLog(anyLong())).thenReturn(Collections.<CommitmentEvent>emptyList());
        when(ledger.currentRoot()).thenReturn(MerkleHashing.emptyRoot());

        OnChainMerkleAccumulator accumulator = new OnChainMerkleAccumulator(ledger, 0L);
        accumulator.sync();

        assertEquals(0L, accumulator.leafCount());
        assertArrayEquals(MerkleHashing.emptyRoot(), accumulator.root());
    }

    @Test
    public void operations_before_sync_are_rejected() {
        OnChainMerkleAccumulator accumulator = new OnChainMerkleAccumulator(mock(LedgerClient.class), 0L);
        assertThrows(IllegalStateException.class, accumulator::root);
        assertThrows(IllegalStateException.class, () -> accumulator.insert(leaf(1)));
        assertThrows(IllegalStateException.class, () -> accumulator.generateProof(0));
        assertThrows(IllegalStateException.class, accumulator::verifyRoot);
    }

    @Test
    public void verify_root_reports_ledger_drift_without_throwing() {
        LedgerClient ledger = mock(LedgerClient.class);
        when(ledger.readCommitmentLog(anyLong())).thenReturn(Collections.<CommitmentEvent>emptyList());
        when(ledger.currentRoot()).thenReturn(MerkleHashing.emptyRoot(), MerkleHashing.emptyRoot(), leaf(7));

        OnChainMerkleAccumulator accumulator = new OnChainMerkleAccumulator(ledger, 0L);
        accumulator.sync();

        assertTrue(accumulator.verifyRoot().matches());
        OnChainMerkleAccumulator.RootCheck drift = accumulator.verifyRoot();
        assertFalse(drift.matches());
        assertNotEquals(drift.getLocalRoot(), drift.getLedgerRoot());
    }
}
