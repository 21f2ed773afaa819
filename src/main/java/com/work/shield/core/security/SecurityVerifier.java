package com.work.shield.core.security;

import com.work.shield.core.chain.CommitmentEvent;
import com.work.shield.core.chain.LedgerClient;
import com.work.shield.core.crypto.CommitmentScheme;
import com.work.shield.core.exception.SecurityViolationException;
import com.work.shield.core.exception.ValidationException;
import com.work.shield.core.model.Note;
import com.work.shield.core.support.ByteUtils;
import com.work.shield.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 证明前的安全闸门：每个输入 note 的承诺必须已在账本上，且位于声明的叶子位置。
 * <p>
 * 防御伪造输入（无限增发）与篡改位置的请求，失败即抛出 {@link SecurityViolationException}，
 * 不会创建任何 job。只有本地模拟账本才允许跳过校验。
 * </p>
 */
public class SecurityVerifier {

    private static final Logger log = LoggerFactory.getLogger(SecurityVerifier.class);

    private final LedgerClient ledger;
    private final long deploymentBlock;
    private final boolean bypass;

    public SecurityVerifier(LedgerClient ledger, long deploymentBlock) {
        this(ledger, deploymentBlock, false);
    }

    /**
     * @param localSimulation 请求跳过校验；仅当账本为模拟账本时允许
     * @throws IllegalStateException 对真实账本请求跳过校验
     */
    public SecurityVerifier(LedgerClient ledger, long deploymentBlock, boolean localSimulation) {
        this.ledger = ValidationUtils.requireNonNull(ledger, "ledger");
        this.deploymentBlock = ValidationUtils.requireNonNegative(deploymentBlock, "deploymentBlock");
        if (localSimulation && !ledger.isSimulated()) {
            throw new IllegalStateException("security bypass is only allowed against a simulated ledger");
        }
        this.bypass = localSimulation;
        if (bypass) {
            log.warn("security verification bypassed (local simulation against mock ledger)");
        }
    }

    public boolean isBypassed() {
        return bypass;
    }

    public void verify(List<Note> inputNotes, List<Long> claimedIndices) {
        if (inputNotes == null || claimedIndices == null || inputNotes.size() != claimedIndices.size()) {
            throw new ValidationException("inputNotes and inputIndices must have the same length");
        }
        if (bypass) {
            return;
        }

        Map<String, Long> onChain = new HashMap<>();
        for (CommitmentEvent event : ledger.readCommitmentLog(deploymentBlock)) {
            onChain.putIfAbsent(event.getCommitmentHex(), event.getLeafIndex());
        }

        for (int i = 0; i < inputNotes.size(); i++) {
            String commitment = ByteUtils.toHex(CommitmentScheme.commit(inputNotes.get(i)));
            long claimed = claimedIndices.get(i);
            Long actual = onChain.get(commitment);
            if (actual == null || actual != claimed) {
                log.warn("security check failed input={} commitment={} claimed={} actual={}",
                        i, commitment, claimed, actual);
                throw new SecurityViolationException(i, commitment, claimed, actual);
            }
        }
        log.debug("security check passed inputs={} onChainCommitments={}", inputNotes.size(), onChain.size());
    }
}
