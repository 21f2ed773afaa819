package com.work.shield.core.model;

import com.work.shield.core.support.ByteUtils;
import com.work.shield.core.support.ValidationUtils;

import java.util.Arrays;

/**
 * 私密 note：金额 + 接收方公钥 x 坐标 + 随机 blinding。
 * <p>金额在模型层按非负 long 处理。</p>
 */
public final class Note {

    private final long amount;
    private final byte[] ownerPubkey;
    private final byte[] blinding;

    public Note(long amount, byte[] ownerPubkey, byte[] blinding) {
        this.amount = ValidationUtils.requireNonNegative(amount, "amount");
        this.ownerPubkey = ValidationUtils.requireLength(ownerPubkey, ByteUtils.HASH_LENGTH, "ownerPubkey").clone();
        this.blinding = ValidationUtils.requireLength(blinding, ByteUtils.HASH_LENGTH, "blinding").clone();
    }

    public long getAmount() {
        return amount;
    }

    public byte[] getOwnerPubkey() {
        return ownerPubkey.clone();
    }

    public byte[] getBlinding() {
        return blinding.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Note)) {
            return false;
        }
        Note other = (Note) o;
        return amount == other.amount
                && Arrays.equals(ownerPubkey, other.ownerPubkey)
                && Arrays.equals(blinding, other.blinding);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(amount);
        result = 31 * result + Arrays.hashCode(ownerPubkey);
        return 31 * result + Arrays.hashCode(blinding);
    }

    @Override
    public String toString() {
        return "Note{amount=" + amount + ", owner=" + ByteUtils.toHex(ownerPubkey) + "}";
    }
}
