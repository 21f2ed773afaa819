package com.work.shield.core.crypto;

/**
 * 钱包签名能力。签名格式固定为 65 字节 r(32) || s(32) || v(1)，v ∈ {27, 28}。
 */
public interface WalletSigner {

    /**
     * 33 字节压缩公钥。
     */
    byte[] publicKey();

    /**
     * note 的 owner 字段：压缩公钥去掉前缀字节后的 32 字节 x 坐标。
     */
    byte[] ownerKey();

    /**
     * 对外展示的地址（压缩公钥的 0x 十六进制）。
     */
    String address();

    byte[] sign(byte[] message);
}
