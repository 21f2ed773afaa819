package com.work.shield.lattice.balance;

import com.work.shield.core.model.Note;
import com.work.shield.core.model.Utxo;
import com.work.shield.core.model.Wallet;
import com.work.shield.core.tx.BuiltTransaction;
import com.work.shield.lattice.domain.Edge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 余额交叉校验：钱包运行余额 == 未花费 UTXO 之和；接收方收到的金额 == 边金额。
 * <p>违规只作为诊断记录并出现在最终报告中，不会中断执行。</p>
 */
public class BalanceVerifier {

    private static final Logger log = LoggerFactory.getLogger(BalanceVerifier.class);

    private final List<EdgeBalanceVerification> edgeVerifications = new ArrayList<>();
    private int walletChecks;

    public synchronized EdgeBalanceVerification verifyEdge(Edge edge, Wallet sender, Wallet receiver) {
        List<BalanceViolation> violations = new ArrayList<>();
        WalletBalanceCheck senderCheck = check(edge.getId(), sender, violations);
        WalletBalanceCheck receiverCheck = check(edge.getId(), receiver, violations);

        long received = receivedAmount(edge, receiver);
        if (received != edge.getAmount()) {
            violations.add(new BalanceViolation(BalanceViolation.Type.WRONG_AMOUNT_RECEIVED, edge.getId(),
                    receiver.getId(), edge.getAmount(), received));
        }
        for (BalanceViolation violation : violations) {
            log.warn("balance check failed edge={} violation={}", edge.getId(), violation);
        }
        EdgeBalanceVerification verification = new EdgeBalanceVerification(edge.getId(), senderCheck,
                receiverCheck, edge.getAmount(), received, violations);
        edgeVerifications.add(verification);
        return verification;
    }

    public synchronized FinalBalanceReport verifyFinal(Collection<Wallet> wallets) {
        List<WalletBalanceCheck> checks = new ArrayList<>(wallets.size());
        for (Wallet wallet : wallets) {
            WalletBalanceCheck check = WalletBalanceCheck.of(wallet);
            walletChecks++;
            if (!check.matches()) {
                log.warn("final balance mismatch wallet={} balance={} utxoTotal={}",
                        wallet.getId(), check.getBalance(), check.getUtxoTotal());
            }
            checks.add(check);
        }
        return new FinalBalanceReport(checks);
    }

    public synchronized List<EdgeBalanceVerification> getEdgeVerifications() {
        return new ArrayList<>(edgeVerifications);
    }

    public synchronized BalanceSummary summary() {
        int inconsistent = 0;
        int wrongAmount = 0;
        for (EdgeBalanceVerification verification : edgeVerifications) {
            for (BalanceViolation violation : verification.getViolations()) {
                if (violation.getType() == BalanceViolation.Type.BALANCE_INCONSISTENT) {
                    inconsistent++;
                } else {
                    wrongAmount++;
                }
            }
        }
        return new BalanceSummary(edgeVerifications.size(), walletChecks, inconsistent, wrongAmount);
    }

    private WalletBalanceCheck check(String edgeId, Wallet wallet, List<BalanceViolation> violations) {
        WalletBalanceCheck check = WalletBalanceCheck.of(wallet);
        walletChecks++;
        if (!check.matches()) {
            violations.add(new BalanceViolation(BalanceViolation.Type.BALANCE_INCONSISTENT, edgeId,
                    wallet.getId(), check.getUtxoTotal(), check.getBalance()));
        }
        return check;
    }

    /**
     * 接收方本次收到的 UTXO：优先按构建时的接收方 note 匹配，否则取最近入账的 UTXO。
     */
    private static long receivedAmount(Edge edge, Wallet receiver) {
        BuiltTransaction tx = edge.getTransaction();
        if (tx != null) {
            Note expected = tx.getRecipientNote();
            for (Utxo utxo : receiver.getUtxos()) {
                if (utxo.getNote().equals(expected)) {
                    return utxo.getAmount();
                }
            }
        }
        Utxo latest = receiver.latestUtxo();
        return latest == null ? 0 : latest.getAmount();
    }
}
