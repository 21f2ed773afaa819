package com.work.shield.lattice.scheduler;

import com.work.shield.core.chain.InMemoryLedgerClient;
import com.work.shield.core.crypto.CommitmentScheme;
import com.work.shield.core.model.Note;
import com.work.shield.core.model.Utxo;
import com.work.shield.core.model.Wallet;

import java.security.SecureRandom;

import static com.work.shield.core.support.ValidationUtils.requireNonNull;

/**
 * 通过模拟账本 deposit 给钱包注资：承诺上链后以账本分配的叶子编号入账。
 */
public class WalletFunder {

    private final InMemoryLedgerClient ledger;
    private final SecureRandom random;

    public WalletFunder(InMemoryLedgerClient ledger) {
        this(ledger, new SecureRandom());
    }

    public WalletFunder(InMemoryLedgerClient ledger, SecureRandom random) {
        this.ledger = requireNonNull(ledger, "ledger");
        this.random = requireNonNull(random, "random");
    }

    public Utxo fund(Wallet wallet, long amount) {
        requireNonNull(wallet, "wallet");
        byte[] blinding = new byte[32];
        random.nextBytes(blinding);
        Note note = new Note(amount, wallet.getOwnerKey(), blinding);
        byte[] commitment = CommitmentScheme.commit(note);
        long index = ledger.deposit(wallet.getAddress(), amount, commitment);
        Utxo utxo = new Utxo(note, commitment, index);
        wallet.credit(utxo);
        return utxo;
    }
}
