package com.work.shield.core;

import com.work.shield.core.exception.ValidationException;
import com.work.shield.core.model.ProofRequest;
import com.work.shield.core.queue.ProofJobQueue;
import com.work.shield.core.queue.ProofJobView;
import com.work.shield.core.queue.QueueStatus;
import com.work.shield.core.queue.SubmitReceipt;
import com.work.shield.core.security.SecurityVerifier;
import com.work.shield.core.support.ByteUtils;

import java.util.List;

import static com.work.shield.core.support.ValidationUtils.requireNonNull;

/**
 * 证明服务的对外门面：结构校验 → 安全闸门 → 入队。
 * <p>校验与安全错误在边界处直接抛出，不会进入队列。</p>
 */
public class ProofService {

    private final SecurityVerifier securityVerifier;
    private final ProofJobQueue queue;

    public ProofService(SecurityVerifier securityVerifier, ProofJobQueue queue) {
        this.securityVerifier = requireNonNull(securityVerifier, "securityVerifier");
        this.queue = requireNonNull(queue, "queue");
    }

    /**
     * @throws ValidationException                                        请求结构非法
     * @throws com.work.shield.core.exception.SecurityViolationException 输入不在链上或位置不符
     */
    public SubmitReceipt submit(ProofRequest request) {
        validate(request);
        securityVerifier.verify(request.getInputNotes(), request.getInputIndices());
        return queue.submit(request);
    }

    public ProofJobView status(String jobId) {
        return queue.status(jobId);
    }

    public QueueStatus queueStatus() {
        return queue.queueStatus();
    }

    public int evictExpired() {
        return queue.evictExpired();
    }

    static void validate(ProofRequest request) {
        if (request == null) {
            throw new ValidationException("request is required");
        }
        List<?> inputs = require(request.getInputNotes(), "inputNotes");
        require(request.getOutputNotes(), "outputNotes");
        int n = inputs.size();
        if (n == 0) {
            throw new ValidationException("inputNotes must not be empty");
        }
        requireSize(request.getNullifierSignatures(), "nullifierSignatures", n);
        requireSize(request.getTxSignatures(), "txSignatures", n);
        requireSize(request.getInputIndices(), "inputIndices", n);
        requireSize(request.getInputProofs(), "inputProofs", n);
        byte[] oldRoot = request.getOldRoot();
        if (oldRoot == null || oldRoot.length != ByteUtils.HASH_LENGTH) {
            throw new ValidationException("oldRoot must be 32 bytes");
        }
    }

    private static List<?> require(List<?> value, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }

    private static void requireSize(List<?> value, String field, int expected) {
        if (require(value, field).size() != expected) {
            throw new ValidationException(field + " length (" + value.size()
                    + ") must match inputNotes length (" + expected + ")");
        }
    }
}
