package com.work.shield.core.security;

import com.work.shield.core.chain.InMemoryLedgerClient;
import com.work.shield.core.chain.LedgerClient;
import com.work.shield.core.crypto.CommitmentScheme;
import com.work.shield.core.exception.SecurityViolationException;
import com.work.shield.core.exception.ValidationException;
import com.work.shield.core.model.Note;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class SecurityVerifierTest {

    private static Note note(long amount, int seed) {
        byte[] owner = new byte[32];
        owner[0] = (byte) seed;
        byte[] blinding = new byte[32];
        blinding[1] = (byte) seed;
        return new Note(amount, owner, blinding);
    }

    @Test
    public void accepts_notes_at_their_ledger_positions() {
        InMemoryLedgerClient ledger = new InMemoryLedgerClient();
        Note a = note(100L, 1);
        Note b = note(50L, 2);
        ledger.deposit("alice", 100L, CommitmentScheme.commit(a));
        ledger.deposit("bob", 50L, CommitmentScheme.commit(b));

        SecurityVerifier verifier = new SecurityVerifier(ledger, 0L);
        assertDoesNotThrow(() -> verifier.verify(Arrays.asList(b, a), Arrays.asList(1L, 0L)));
    }

    @Test
    public void rejects_note_that_was_never_committed() {
        InMemoryLedgerClient ledger = new InMemoryLedgerClient();
        ledger.deposit("alice", 100L, CommitmentScheme.commit(note(100L, 1)));

        SecurityVerifier verifier = new SecurityVerifier(ledger, 0L);
        SecurityViolationException e = assertThrows(SecurityViolationException.class,
                () -> verifier.verify(Collections.singletonList(note(1_000_000L, 9)), Collections.singletonList(0L)));

        assertEquals(0, e.getInputPosition());
        assertEquals(0L, e.getClaimedIndex());
        assertNull(e.getActualIndex());
        assertEquals(SecurityViolationException.CODE, e.getErrorCode());
    }

    @Test
    public void rejects_wrong_claimed_index() {
        InMemoryLedgerClient ledger = new InMemoryLedgerClient();
        Note a = note(100L, 1);
        Note b = note(50L, 2);
        ledger.deposit("alice", 100L, CommitmentScheme.commit(a));
        ledger.deposit("bob", 50L, CommitmentScheme.commit(b));

        SecurityVerifier verifier = new SecurityVerifier(ledger, 0L);
        SecurityViolationException e = assertThrows(SecurityViolationException.class,
                () -> verifier.verify(Arrays.asList(a, b), Arrays.asList(0L, 0L)));

        assertEquals(1, e.getInputPosition());
        assertEquals(Long.valueOf(1L), e.getActualIndex());
    }

    @Test
    public void length_mismatch_is_a_validation_error() {
        SecurityVerifier verifier = new SecurityVerifier(new InMemoryLedgerClient(), 0L);
        assertThrows(ValidationException.class,
                () -> verifier.verify(Collections.singletonList(note(1L, 1)), Arrays.asList(0L, 1L)));
    }

    @Test
    public void bypass_only_on_simulated_ledger() {
        SecurityVerifier simulated = new SecurityVerifier(new InMemoryLedgerClient(), 0L, true);
        assertTrue(simulated.isBypassed());
        assertDoesNotThrow(() -> simulated.verify(Collections.singletonList(note(5L, 5)), Collections.singletonList(3L)));

        LedgerClient real = mock(LedgerClient.class);
        when(real.isSimulated()).thenReturn(false);
        assertThrows(IllegalStateException.class, () -> new SecurityVerifier(real, 0L, true));
        assertFalse(new SecurityVerifier(real, 0L, false).isBypassed());
    }
}
