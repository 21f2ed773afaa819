package com.work.shield.core.prover.wire;

import com.work.shield.core.exception.ValidationException;
import com.work.shield.core.merkle.MerkleProof;
import com.work.shield.core.model.Note;
import com.work.shield.core.model.ProofRequest;
import com.work.shield.core.model.ProofResult;
import com.work.shield.core.model.PublicOutputs;
import com.work.shield.core.support.ByteUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 领域对象与 JSON 载荷之间的转换。入方向对每个字段做结构校验，失败抛 {@link ValidationException}。
 */
public final class ProverWire {

    private static final Pattern HEX = Pattern.compile("^(0x)?([0-9a-fA-F]{2})+$");

    private ProverWire() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static ProofRequestPayload toPayload(ProofRequest request) {
        ProofRequestPayload payload = new ProofRequestPayload();
        payload.setInputNotes(toNotePayloads(request.getInputNotes()));
        payload.setOutputNotes(toNotePayloads(request.getOutputNotes()));
        payload.setNullifierSignatures(toHex(request.getNullifierSignatures()));
        payload.setTxSignatures(toHex(request.getTxSignatures()));
        payload.setInputIndices(new ArrayList<>(request.getInputIndices()));
        List<List<String>> proofs = new ArrayList<>();
        for (MerkleProof proof : request.getInputProofs()) {
            proofs.add(toHex(proof.getSiblings()));
        }
        payload.setInputProofs(proofs);
        payload.setOldRoot(ByteUtils.toHex(request.getOldRoot()));
        return payload;
    }

    public static ProofRequest fromPayload(ProofRequestPayload payload) {
        if (payload == null) {
            throw new ValidationException("request body is required");
        }
        List<Long> indices = require(payload.getInputIndices(), "inputIndices");
        List<List<String>> proofs = require(payload.getInputProofs(), "inputProofs");
        if (proofs.size() != indices.size()) {
            throw new ValidationException("inputProofs length must match inputIndices length");
        }
        List<MerkleProof> merkleProofs = new ArrayList<>();
        for (int i = 0; i < proofs.size(); i++) {
            Long index = indices.get(i);
            if (index == null || proofs.get(i) == null) {
                throw new ValidationException("inputProofs[" + i + "] is required");
            }
            try {
                merkleProofs.add(new MerkleProof(index, fromHex(proofs.get(i), "inputProofs[" + i + "]")));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("inputProofs[" + i + "]: " + e.getMessage());
            }
        }
        return new ProofRequest(
                fromNotePayloads(require(payload.getInputNotes(), "inputNotes"), "inputNotes"),
                fromNotePayloads(require(payload.getOutputNotes(), "outputNotes"), "outputNotes"),
                fromHex(require(payload.getNullifierSignatures(), "nullifierSignatures"), "nullifierSignatures"),
                fromHex(require(payload.getTxSignatures(), "txSignatures"), "txSignatures"),
                indices,
                merkleProofs,
                hex(payload.getOldRoot(), "oldRoot"));
    }

    public static ProverResponsePayload toPayload(ProofResult result) {
        PublicOutputs outputs = result.getPublicOutputs();
        PublicOutputsPayload outputsPayload = new PublicOutputsPayload();
        outputsPayload.setOldRoot(ByteUtils.toHex(outputs.getOldRoot()));
        outputsPayload.setNewRoot(ByteUtils.toHex(outputs.getNewRoot()));
        outputsPayload.setNullifiers(toHex(outputs.getNullifiers()));
        outputsPayload.setOutputCommitments(toHex(outputs.getOutputCommitments()));

        ProverResponsePayload payload = new ProverResponsePayload();
        payload.setProof(ByteUtils.toHex(result.getProof()));
        payload.setPublicValuesRaw(ByteUtils.toHex(result.getPublicValuesRaw()));
        payload.setPublicOutputs(outputsPayload);
        payload.setVkeyHash(ByteUtils.toHex(result.getVkeyHash()));
        return payload;
    }

    /**
     * @throws IllegalArgumentException 证明器输出缺字段或格式错误
     */
    public static ProofResult fromPayload(ProverResponsePayload payload) {
        if (payload == null || payload.getProof() == null || payload.getPublicValuesRaw() == null
                || payload.getPublicOutputs() == null) {
            throw new IllegalArgumentException("prover response missing proof, publicValuesRaw or publicOutputs");
        }
        PublicOutputsPayload outputs = payload.getPublicOutputs();
        if (outputs.getOldRoot() == null || outputs.getNewRoot() == null
                || outputs.getNullifiers() == null || outputs.getOutputCommitments() == null) {
            throw new IllegalArgumentException("prover response publicOutputs incomplete");
        }
        PublicOutputs publicOutputs = new PublicOutputs(
                ByteUtils.fromHex(outputs.getOldRoot()),
                ByteUtils.fromHex(outputs.getNewRoot()),
                decodeAll(outputs.getNullifiers()),
                decodeAll(outputs.getOutputCommitments()));
        byte[] vkeyHash = payload.getVkeyHash() == null ? new byte[0] : ByteUtils.fromHex(payload.getVkeyHash());
        return new ProofResult(ByteUtils.fromHex(payload.getProof()), ByteUtils.fromHex(payload.getPublicValuesRaw()),
                publicOutputs, vkeyHash);
    }

    private static List<NotePayload> toNotePayloads(List<Note> notes) {
        List<NotePayload> out = new ArrayList<>(notes.size());
        for (Note note : notes) {
            out.add(new NotePayload(note.getAmount(), ByteUtils.toHex(note.getOwnerPubkey()),
                    ByteUtils.toHex(note.getBlinding())));
        }
        return out;
    }

    private static List<Note> fromNotePayloads(List<NotePayload> payloads, String field) {
        List<Note> out = new ArrayList<>(payloads.size());
        for (int i = 0; i < payloads.size(); i++) {
            NotePayload payload = payloads.get(i);
            String name = field + "[" + i + "]";
            if (payload == null || payload.getAmount() == null) {
                throw new ValidationException(name + ".amount is required");
            }
            try {
                out.add(new Note(payload.getAmount(), hex(payload.getOwnerPubkey(), name + ".ownerPubkey"),
                        hex(payload.getBlinding(), name + ".blinding")));
            } catch (IllegalArgumentException e) {
                throw new ValidationException(name + ": " + e.getMessage());
            }
        }
        return out;
    }

    private static <T> List<T> require(List<T> value, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }

    private static byte[] hex(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new ValidationException(field + " is required");
        }
        if (!HEX.matcher(value).matches()) {
            throw new ValidationException(field + " is not valid hex");
        }
        return ByteUtils.fromHex(value);
    }

    private static List<byte[]> fromHex(List<String> values, String field) {
        List<byte[]> out = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            out.add(hex(values.get(i), field + "[" + i + "]"));
        }
        return out;
    }

    private static List<byte[]> decodeAll(List<String> values) {
        List<byte[]> out = new ArrayList<>(values.size());
        for (String value : values) {
            out.add(ByteUtils.fromHex(value));
        }
        return out;
    }

    private static List<String> toHex(List<byte[]> values) {
        List<String> out = new ArrayList<>(values.size());
        for (byte[] value : values) {
            out.add(ByteUtils.toHex(value));
        }
        return out;
    }
}
