package com.novelforge.common.exception;

/**
 * 记忆条目、快照或生成请求不存在
 */
public class NotFoundException extends NovelMemoryException {

    public NotFoundException(String message) {
        super(message, "NOT_FOUND");
    }
}
