package com.work.shield.lattice.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class EdgeTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    public void happy_path_records_history_and_durations() {
        Edge edge = new Edge("e1", "alice", "bob", 50L, null);
        edge.transition(EdgeState.PROVING, T0);
        edge.markProofComplete(T0.plusSeconds(3));
        edge.transition(EdgeState.SUBMITTED, T0.plusSeconds(3));
        edge.transition(EdgeState.CONFIRMED, T0.plusSeconds(5));

        assertEquals(EdgeState.CONFIRMED, edge.getState());
        assertEquals(3, edge.getHistory().size());
        assertEquals(EdgeState.READY, edge.getHistory().get(0).getFrom());
        assertEquals(3000L, edge.proofDuration().toMillis());
        assertEquals(5000L, edge.totalDuration().toMillis());
        assertEquals(Collections.<String>emptyList(), edge.getDependsOn());
    }

    @Test
    public void states_never_move_backwards() {
        Edge edge = new Edge("e1", "alice", "bob", 50L, null);
        assertThrows(IllegalStateException.class, () -> edge.transition(EdgeState.SUBMITTED, T0));
        edge.transition(EdgeState.PROVING, T0);
        assertThrows(IllegalStateException.class, () -> edge.transition(EdgeState.READY, T0));
        assertThrows(IllegalStateException.class, () -> edge.transition(EdgeState.PROVING, T0));
    }

    @Test
    public void terminal_edges_reject_further_changes() {
        Edge edge = new Edge("e1", "alice", "bob", 50L, null);
        edge.fail("proof-timeout", T0);

        assertEquals(EdgeState.FAILED, edge.getState());
        assertEquals("proof-timeout", edge.getError());
        assertNull(edge.proofDuration());
        assertThrows(IllegalStateException.class, () -> edge.fail("again", T0));
        assertEquals("proof-timeout", edge.getError());
    }

    @Test
    public void non_positive_amount_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new Edge("e1", "alice", "bob", 0L, null));
    }

    @Test
    public void state_machine_allows_failure_from_any_live_state() {
        for (EdgeState state : EdgeState.values()) {
            assertEquals(!state.isTerminal(), state.canTransitionTo(EdgeState.FAILED), state.name());
        }
        assertFalse(EdgeState.READY.canTransitionTo(EdgeState.CONFIRMED));
        assertFalse(EdgeState.PROVING.canTransitionTo(null));
    }
}
