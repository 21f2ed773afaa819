package com.work.shield.core.crypto;

import com.work.shield.core.support.ValidationUtils;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * secp256k1 签名器，消息先 keccak256 再按以太坊个人消息前缀签名。
 */
public class EcdsaWalletSigner implements WalletSigner {

    private static final String KEY_DERIVATION_PREFIX = "utxo-prototype-v1-key-derivation:";

    private final ECKeyPair keyPair;
    private final byte[] compressedPublicKey;

    public EcdsaWalletSigner(ECKeyPair keyPair) {
        this.keyPair = ValidationUtils.requireNonNull(keyPair, "keyPair");
        this.compressedPublicKey = Sign.publicPointFromPrivate(keyPair.getPrivateKey()).getEncoded(true);
    }

    /**
     * 由种子确定性派生私钥：sha256("utxo-prototype-v1-key-derivation:" + seed)。
     */
    public static EcdsaWalletSigner fromSeed(String seed) {
        ValidationUtils.requireNonEmpty(seed, "seed");
        byte[] privateKey = Hash.sha256((KEY_DERIVATION_PREFIX + seed).getBytes(StandardCharsets.UTF_8));
        return new EcdsaWalletSigner(ECKeyPair.create(privateKey));
    }

    public BigInteger privateKey() {
        return keyPair.getPrivateKey();
    }

    @Override
    public byte[] publicKey() {
        return compressedPublicKey.clone();
    }

    @Override
    public byte[] ownerKey() {
        return Arrays.copyOfRange(compressedPublicKey, 1, compressedPublicKey.length);
    }

    @Override
    public String address() {
        return Numeric.toHexString(compressedPublicKey);
    }

    @Override
    public byte[] sign(byte[] message) {
        ValidationUtils.requireNonNull(message, "message");
        Sign.SignatureData signature = Sign.signPrefixedMessage(Hash.sha3(message), keyPair);
        byte[] out = new byte[65];
        System.arraycopy(signature.getR(), 0, out, 0, 32);
        System.arraycopy(signature.getS(), 0, out, 32, 32);
        out[64] = signature.getV()[0];
        return out;
    }
}
