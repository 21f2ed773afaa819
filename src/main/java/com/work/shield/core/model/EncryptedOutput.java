package com.work.shield.core.model;

/**
 * 发给接收方的加密 note。keyType 目前固定为 0（secp256k1 ECIES）。
 */
public final class EncryptedOutput {

    public static final int KEY_TYPE_SECP256K1 = 0;

    private final byte[] commitment;
    private final int keyType;
    private final byte[] ephemeralPubkey;
    private final byte[] nonce;
    private final byte[] ciphertext;

    public EncryptedOutput(byte[] commitment, int keyType, byte[] ephemeralPubkey, byte[] nonce, byte[] ciphertext) {
        this.commitment = commitment == null ? null : commitment.clone();
        this.keyType = keyType;
        this.ephemeralPubkey = ephemeralPubkey.clone();
        this.nonce = nonce.clone();
        this.ciphertext = ciphertext.clone();
    }

    /**
     * 绑定到证明输出的承诺后返回新实例。
     */
    public EncryptedOutput withCommitment(byte[] boundCommitment) {
        return new EncryptedOutput(boundCommitment, keyType, ephemeralPubkey, nonce, ciphertext);
    }

    /**
     * @return 承诺；尚未绑定时为 null
     */
    public byte[] getCommitment() {
        return commitment == null ? null : commitment.clone();
    }

    public int getKeyType() {
        return keyType;
    }

    public byte[] getEphemeralPubkey() {
        return ephemeralPubkey.clone();
    }

    public byte[] getNonce() {
        return nonce.clone();
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }
}
