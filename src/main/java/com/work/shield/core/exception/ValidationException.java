package com.work.shield.core.exception;

/**
 * 请求结构非法（缺字段、列表长度不一致等），在进入队列之前拒绝。
 */
public class ValidationException extends ShieldException {

    public static final String CODE = "validation_error";

    public ValidationException(String message) {
        super(CODE, message);
    }

    protected ValidationException(String code, String message) {
        super(code, message);
    }
}
