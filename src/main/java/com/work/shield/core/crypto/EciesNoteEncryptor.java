package com.work.shield.core.crypto;

import com.work.shield.core.model.EncryptedOutput;
import com.work.shield.core.model.Note;
import com.work.shield.core.support.ValidationUtils;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.math.ec.ECPoint;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * secp256k1 ECIES：临时密钥 ECDH（压缩点）→ HKDF-SHA256 → AES-256-GCM。
 * <p>明文布局：amount(32 字节大端) || owner(32) || blinding(32)。</p>
 */
public class EciesNoteEncryptor implements NoteEncryptor {

    private static final X9ECParameters CURVE = CustomNamedCurves.getByName("secp256k1");
    private static final byte[] KDF_INFO = "utxo-prototype-v1-encryption".getBytes(StandardCharsets.US_ASCII);
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_BITS = 128;
    private static final int FIELD_LENGTH = 32;

    private final SecureRandom random;

    public EciesNoteEncryptor() {
        this(new SecureRandom());
    }

    public EciesNoteEncryptor(SecureRandom random) {
        this.random = ValidationUtils.requireNonNull(random, "random");
    }

    @Override
    public EncryptedOutput encrypt(Note note, byte[] recipientPublicKey) {
        ValidationUtils.requireLength(recipientPublicKey, 33, "recipientPublicKey");
        BigInteger ephemeralPrivate = randomScalar();
        byte[] ephemeralPublic = CURVE.getG().multiply(ephemeralPrivate).normalize().getEncoded(true);
        ECPoint recipient = CURVE.getCurve().decodePoint(recipientPublicKey);
        byte[] key = deriveKey(recipient.multiply(ephemeralPrivate).normalize().getEncoded(true));

        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        byte[] ciphertext = aesGcm(Cipher.ENCRYPT_MODE, key, nonce, plaintext(note));
        return new EncryptedOutput(null, EncryptedOutput.KEY_TYPE_SECP256K1, ephemeralPublic, nonce, ciphertext);
    }

    /**
     * 接收方用私钥解出 note。认证标签不匹配时抛出 IllegalStateException。
     */
    public Note decrypt(EncryptedOutput output, BigInteger recipientPrivateKey) {
        ValidationUtils.requireNonNull(output, "output");
        ValidationUtils.requireNonNull(recipientPrivateKey, "recipientPrivateKey");
        ECPoint ephemeral = CURVE.getCurve().decodePoint(output.getEphemeralPubkey());
        byte[] key = deriveKey(ephemeral.multiply(recipientPrivateKey).normalize().getEncoded(true));
        byte[] plain = aesGcm(Cipher.DECRYPT_MODE, key, output.getNonce(), output.getCiphertext());
        long amount = new BigInteger(1, Arrays.copyOfRange(plain, 0, FIELD_LENGTH)).longValueExact();
        return new Note(amount,
                Arrays.copyOfRange(plain, FIELD_LENGTH, 2 * FIELD_LENGTH),
                Arrays.copyOfRange(plain, 2 * FIELD_LENGTH, 3 * FIELD_LENGTH));
    }

    private BigInteger randomScalar() {
        BigInteger n = CURVE.getN();
        BigInteger k;
        do {
            k = new BigInteger(n.bitLength(), random);
        } while (k.signum() == 0 || k.compareTo(n) >= 0);
        return k;
    }

    private static byte[] deriveKey(byte[] sharedSecret) {
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(sharedSecret, null, KDF_INFO));
        byte[] key = new byte[32];
        hkdf.generateBytes(key, 0, key.length);
        return key;
    }

    private static byte[] plaintext(Note note) {
        byte[] out = new byte[3 * FIELD_LENGTH];
        byte[] amount = BigInteger.valueOf(note.getAmount()).toByteArray();
        int amountLength = Math.min(amount.length, FIELD_LENGTH);
        System.arraycopy(amount, amount.length - amountLength, out, FIELD_LENGTH - amountLength, amountLength);
        System.arraycopy(note.getOwnerPubkey(), 0, out, FIELD_LENGTH, FIELD_LENGTH);
        System.arraycopy(note.getBlinding(), 0, out, 2 * FIELD_LENGTH, FIELD_LENGTH);
        return out;
    }

    private static byte[] aesGcm(int mode, byte[] key, byte[] nonce, byte[] input) {
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(mode, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, nonce));
            return cipher.doFinal(input);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM " + (mode == Cipher.ENCRYPT_MODE ? "encrypt" : "decrypt") + " failed", e);
        }
    }
}
