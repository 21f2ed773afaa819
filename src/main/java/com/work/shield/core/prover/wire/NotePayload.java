package com.work.shield.core.prover.wire;

/**
 * note 的 JSON 形式：金额为十进制数字，字节字段为 0x 十六进制。
 */
public class NotePayload {

    private Long amount;
    private String ownerPubkey;
    private String blinding;

    public NotePayload() {
    }

    public NotePayload(Long amount, String ownerPubkey, String blinding) {
        this.amount = amount;
        this.ownerPubkey = ownerPubkey;
        this.blinding = blinding;
    }

    public Long getAmount() {
        return amount;
    }

    public void setAmount(Long amount) {
        this.amount = amount;
    }

    public String getOwnerPubkey() {
        return ownerPubkey;
    }

    public void setOwnerPubkey(String ownerPubkey) {
        this.ownerPubkey = ownerPubkey;
    }

    public String getBlinding() {
        return blinding;
    }

    public void setBlinding(String blinding) {
        this.blinding = blinding;
    }
}
