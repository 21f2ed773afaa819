package com.work.shield.core.crypto;

import com.work.shield.core.model.EncryptedOutput;
import com.work.shield.core.model.Note;

/**
 * 把输出 note 加密给接收方，使其能在链上事件中发现并解出自己的 note。
 */
public interface NoteEncryptor {

    /**
     * @param recipientPublicKey 接收方 33 字节压缩公钥
     */
    EncryptedOutput encrypt(Note note, byte[] recipientPublicKey);
}
