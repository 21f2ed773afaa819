package com.work.shield.core.crypto;

import com.work.shield.core.exception.ValidationException;
import com.work.shield.core.model.Note;
import com.work.shield.core.support.ByteUtils;
import org.bouncycastle.crypto.digests.Blake3Digest;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * note 承诺与 nullifier 的确定性摘要。
 * <p>
 * 构建器、安全校验、模拟证明器与账本都必须按字节一致地计算承诺：
 * <pre>
 * commitment = BLAKE3("NOTE_COMMITMENT_v1" || amount(u64 LE) || owner(32) || blinding(32))
 * nullifier  = BLAKE3("NULLIFIER_v1" || signature)
 * </pre>
 * </p>
 */
public final class CommitmentScheme {

    private static final byte[] COMMITMENT_DOMAIN = "NOTE_COMMITMENT_v1".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULLIFIER_DOMAIN = "NULLIFIER_v1".getBytes(StandardCharsets.US_ASCII);

    private CommitmentScheme() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static byte[] commit(Note note) {
        return commit(note.getAmount(), note.getOwnerPubkey(), note.getBlinding());
    }

    /**
     * amount 按无符号 64 位解释，负数 long 即对应 2^63 以上的金额。
     */
    public static byte[] commit(long amount, byte[] owner, byte[] blinding) {
        requireBytes32(owner, "owner");
        requireBytes32(blinding, "blinding");
        byte[] amountLe = ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(amount).array();
        return blake3(COMMITMENT_DOMAIN, amountLe, owner, blinding);
    }

    public static byte[] nullifier(byte[] signature) {
        if (signature == null || signature.length == 0) {
            throw new ValidationException("nullifier signature 不能为空");
        }
        return blake3(NULLIFIER_DOMAIN, signature);
    }

    /**
     * 交易绑定签名覆盖的消息：nullifier || 所有输出承诺按顺序拼接。
     */
    public static byte[] txBindingMessage(byte[] nullifier, List<byte[]> outputCommitments) {
        requireBytes32(nullifier, "nullifier");
        for (byte[] commitment : outputCommitments) {
            requireBytes32(commitment, "outputCommitment");
        }
        return ByteUtils.concat(nullifier, outputCommitments);
    }

    private static void requireBytes32(byte[] value, String name) {
        if (value == null || value.length != ByteUtils.HASH_LENGTH) {
            throw new ValidationException(name + " 必须为 32 字节");
        }
    }

    private static byte[] blake3(byte[]... parts) {
        Blake3Digest digest = new Blake3Digest(256);
        for (byte[] part : parts) {
            digest.update(part, 0, part.length);
        }
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }
}
