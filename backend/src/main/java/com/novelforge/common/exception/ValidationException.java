package com.novelforge.common.exception;

/**
 * 请求格式错误
 */
public class ValidationException extends NovelMemoryException {

    public ValidationException(String message) {
        super(message, "VALIDATION_ERROR");
    }
}
