package com.work.shield.lattice.domain;

import com.work.shield.core.crypto.EcdsaWalletSigner;
import com.work.shield.core.model.Wallet;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TopologyTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static List<Wallet> wallets(int count) {
        List<Wallet> wallets = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            wallets.add(new Wallet("w" + i, EcdsaWalletSigner.fromSeed("topology-w" + i)));
        }
        return wallets;
    }

    private static List<String> ids(List<Edge> edges) {
        List<String> ids = new ArrayList<>();
        for (Edge edge : edges) {
            ids.add(edge.getId());
        }
        return ids;
    }

    @Test
    public void chain_releases_one_edge_at_a_time() {
        Topology topology = Topologies.chain(wallets(3), 10L);

        assertEquals(2, topology.getEdges().size());
        assertEquals(1, topology.readyEdges().size());
        Edge first = topology.edge("chain-0");
        first.transition(EdgeState.PROVING, T0);
        assertTrue(topology.readyEdges().isEmpty());
        assertEquals(1, topology.inFlightCount());

        first.transition(EdgeState.SUBMITTED, T0);
        first.transition(EdgeState.CONFIRMED, T0);
        assertEquals(1, topology.readyEdges().size());
        assertEquals("chain-1", topology.readyEdges().get(0).getId());
        assertFalse(topology.isComplete());
    }

    @Test
    public void failure_cascades_through_transitive_dependents() {
        Topology topology = Topologies.chain(wallets(4), 10L);
        Edge first = topology.edge("chain-0");
        first.fail("proof-timeout", T0);

        List<Edge> cascaded = topology.failDependents(first, T0);

        assertEquals(2, cascaded.size());
        assertEquals("dependency-failed:chain-0", topology.edge("chain-1").getError());
        assertEquals("dependency-failed:chain-1", topology.edge("chain-2").getError());
        assertTrue(topology.isComplete());
        assertEquals(3, topology.summary().count(EdgeState.FAILED));
    }

    @Test
    public void diamond_has_two_independent_roots() {
        Topology topology = Topologies.diamond(wallets(4));

        assertEquals(4, topology.getWallets().size());
        List<String> ready = ids(topology.readyEdges());
        assertEquals(2, ready.size());
        assertTrue(ready.contains("A->B"));
        assertTrue(ready.contains("A->C"));

        Edge ab = topology.edge("A->B");
        ab.fail("relayer-failure", T0);
        topology.failDependents(ab, T0);
        assertEquals(EdgeState.FAILED, topology.edge("B->D").getState());
        assertEquals(EdgeState.READY, topology.edge("C->D").getState());
    }

    @Test
    public void fan_shapes_have_no_dependencies() {
        List<Wallet> wallets = wallets(4);
        Topology out = Topologies.fanOut(wallets.get(0), wallets.subList(1, 4), 5L);
        Topology in = Topologies.fanIn(wallets.subList(1, 4), wallets.get(0), 5L);

        assertEquals(3, out.readyEdges().size());
        assertEquals(3, in.readyEdges().size());
        assertEquals("w0", out.edge("fanout-2").getFrom());
        assertEquals("w0", in.edge("fanin-2").getTo());
    }

    @Test
    public void dependencies_must_already_exist() {
        Topology topology = new Topology("manual");
        topology.addEdge("a", "x", "y", 1L);
        assertThrows(IllegalArgumentException.class, () -> topology.addEdge("b", "y", "z", 1L, "missing"));
        assertThrows(IllegalArgumentException.class, () -> topology.addEdge("a", "y", "z", 1L));
        assertNull(topology.wallet("x"));
    }

    @Test
    public void summary_counts_every_state() {
        Topology topology = Topologies.chain(wallets(3), 10L);
        TopologySummary summary = topology.summary();

        assertEquals("chain", summary.getName());
        assertEquals(3, summary.getWalletCount());
        assertEquals(2, summary.getEdgeCount());
        assertEquals(2, summary.count(EdgeState.READY));
        assertEquals(0, summary.count(EdgeState.CONFIRMED));
    }
}
