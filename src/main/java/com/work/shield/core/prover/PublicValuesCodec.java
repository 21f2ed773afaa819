package com.work.shield.core.prover;

import com.work.shield.core.model.PublicOutputs;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.utils.Numeric;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 公开值的 ABI 编解码：
 * (bytes32 oldRoot, bytes32 newRoot, bytes32[] nullifiers, bytes32[] outputCommitments)。
 * <p>账本合约直接从 publicValues 解码，所以证明绑定的值就是合约使用的值。</p>
 */
public final class PublicValuesCodec {

    private static final List<TypeReference<Type>> LAYOUT = Utils.convert(Arrays.<TypeReference<?>>asList(
            new TypeReference<Bytes32>() {
            },
            new TypeReference<Bytes32>() {
            },
            new TypeReference<DynamicArray<Bytes32>>() {
            },
            new TypeReference<DynamicArray<Bytes32>>() {
            }));

    private PublicValuesCodec() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static byte[] encode(PublicOutputs outputs) {
        List<Type> params = Arrays.<Type>asList(
                new Bytes32(outputs.getOldRoot()),
                new Bytes32(outputs.getNewRoot()),
                toArray(outputs.getNullifiers()),
                toArray(outputs.getOutputCommitments()));
        return Numeric.hexStringToByteArray(FunctionEncoder.encodeConstructor(params));
    }

    /**
     * @throws IllegalArgumentException 字节串不是合法的公开值编码
     */
    public static PublicOutputs decode(byte[] raw) {
        List<Type> decoded;
        try {
            decoded = FunctionReturnDecoder.decode(Numeric.toHexString(raw), LAYOUT);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("malformed public values: " + e.getMessage(), e);
        }
        if (decoded.size() != 4) {
            throw new IllegalArgumentException("malformed public values: expected 4 fields, got " + decoded.size());
        }
        return new PublicOutputs(
                ((Bytes32) decoded.get(0)).getValue(),
                ((Bytes32) decoded.get(1)).getValue(),
                fromArray(decoded.get(2)),
                fromArray(decoded.get(3)));
    }

    private static DynamicArray<Bytes32> toArray(List<byte[]> values) {
        List<Bytes32> items = new ArrayList<>(values.size());
        for (byte[] value : values) {
            items.add(new Bytes32(value));
        }
        return new DynamicArray<>(Bytes32.class, items);
    }

    /**
     * LAYOUT 已把该位置限定为 bytes32[]，解码器按声明类型构造元素。
     */
    @SuppressWarnings("unchecked")
    private static List<byte[]> fromArray(Type<?> field) {
        DynamicArray<Bytes32> array = (DynamicArray<Bytes32>) field;
        List<byte[]> out = new ArrayList<>(array.getValue().size());
        for (Bytes32 item : array.getValue()) {
            out.add(item.getValue());
        }
        return out;
    }
}
