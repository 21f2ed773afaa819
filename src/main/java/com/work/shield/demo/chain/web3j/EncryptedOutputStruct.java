package com.work.shield.demo.chain.web3j;

import com.work.shield.core.model.EncryptedOutput;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.DynamicStruct;
import org.web3j.abi.datatypes.generated.Bytes12;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint8;

import java.math.BigInteger;

/**
 * 合约 submitTx 的 tuple(bytes32 commitment, uint8 keyType, bytes ephemeralPubkey, bytes12 nonce, bytes ciphertext)。
 */
public class EncryptedOutputStruct extends DynamicStruct {

    public EncryptedOutputStruct(byte[] commitment, int keyType, byte[] ephemeralPubkey, byte[] nonce,
                                 byte[] ciphertext) {
        super(new Bytes32(commitment),
                new Uint8(BigInteger.valueOf(keyType)),
                new DynamicBytes(ephemeralPubkey),
                new Bytes12(nonce),
                new DynamicBytes(ciphertext));
    }

    public static EncryptedOutputStruct of(EncryptedOutput output) {
        if (output.getCommitment() == null) {
            throw new IllegalArgumentException("encrypted output 尚未绑定承诺");
        }
        return new EncryptedOutputStruct(output.getCommitment(), output.getKeyType(), output.getEphemeralPubkey(),
                output.getNonce(), output.getCiphertext());
    }
}
