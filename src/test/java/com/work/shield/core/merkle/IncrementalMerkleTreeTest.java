package com.work.shield.core.merkle;

import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IncrementalMerkleTreeTest {

    static byte[] leaf(int seed) {
        return Hash.sha3(new byte[]{(byte) seed});
    }

    @Test
    public void empty_tree_root_is_zero_subtree_of_top_level() {
        IncrementalMerkleTree tree = new IncrementalMerkleTree();
        assertArrayEquals(MerkleHashing.zero(MerkleHashing.DEPTH - 1), tree.root());
        assertArrayEquals(MerkleHashing.emptyRoot(), tree.root());
        assertEquals(0L, tree.leafCount());
    }

    @Test
    public void zero_table_is_hash_of_children() {
        assertArrayEquals(new byte[32], MerkleHashing.zero(0));
        assertArrayEquals(MerkleHashing.hashPair(MerkleHashing.zero(3), MerkleHashing.zero(3)), MerkleHashing.zero(4));
    }

    @Test
    public void single_leaf_root_folds_with_zero_siblings() {
        IncrementalMerkleTree tree = new IncrementalMerkleTree();
        byte[] a = leaf(1);
        assertEquals(0L, tree.insert(a));

        byte[] expected = a;
        for (int level = 0; level < MerkleHashing.DEPTH; level++) {
            expected = MerkleHashing.hashPair(expected, MerkleHashing.zero(level));
        }
        assertArrayEquals(expected, tree.root());
    }

    @Test
    public void two_leaf_root_hashes_pair_first() {
        IncrementalMerkleTree tree = IncrementalMerkleTree.of(Arrays.asList(leaf(1), leaf(2)));

        byte[] expected = MerkleHashing.hashPair(leaf(1), leaf(2));
        for (int level = 1; level < MerkleHashing.DEPTH; level++) {
            expected = MerkleHashing.hashPair(expected, MerkleHashing.zero(level));
        }
        assertArrayEquals(expected, tree.root());
    }

    @Test
    public void every_leaf_proof_verifies_against_current_root() {
        IncrementalMerkleTree tree = new IncrementalMerkleTree();
        List<byte[]> leaves = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            leaves.add(leaf(i));
            tree.insert(leaf(i));
        }
        byte[] root = tree.root();
        for (int i = 0; i < leaves.size(); i++) {
            MerkleProof proof = tree.generateProof(i);
            assertEquals(i, proof.getLeafIndex());
            assertEquals(MerkleHashing.DEPTH, proof.getSiblings().size());
            assertTrue(proof.verify(leaves.get(i), root), "leaf " + i);
            assertFalse(proof.verify(leaf(99), root));
        }
    }

    @Test
    public void proof_taken_at_a_root_keeps_verifying_that_root() {
        IncrementalMerkleTree tree = IncrementalMerkleTree.of(Arrays.asList(leaf(1), leaf(2), leaf(3)));
        byte[] oldRoot = tree.root();
        MerkleProof proof = tree.generateProof(1);

        tree.insert(leaf(4));
        tree.insert(leaf(5));

        assertTrue(proof.verify(leaf(2), oldRoot));
        assertFalse(proof.verify(leaf(2), tree.root()));
        assertTrue(tree.generateProof(1).verify(leaf(2), tree.root()));
    }

    @Test
    public void rebuilding_from_same_leaves_gives_same_root() {
        List<byte[]> leaves = Arrays.asList(leaf(1), leaf(2), leaf(3));
        assertArrayEquals(IncrementalMerkleTree.of(leaves).root(), IncrementalMerkleTree.of(leaves).root());
        assertFalse(Arrays.equals(IncrementalMerkleTree.of(leaves).root(),
                IncrementalMerkleTree.of(Arrays.asList(leaf(2), leaf(1), leaf(3))).root()));
    }

    @Test
    public void index_lookup_and_bounds() {
        IncrementalMerkleTree tree = IncrementalMerkleTree.of(Arrays.asList(leaf(1), leaf(2)));
        assertEquals(1L, tree.indexOf(leaf(2)));
        assertEquals(-1L, tree.indexOf(leaf(3)));
        assertArrayEquals(leaf(1), tree.leaf(0));
        assertThrows(IllegalArgumentException.class, () -> tree.generateProof(2));
        assertThrows(IllegalArgumentException.class, () -> tree.insert(new byte[31]));
    }
}
