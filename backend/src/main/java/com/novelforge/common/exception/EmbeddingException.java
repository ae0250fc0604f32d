package com.novelforge.common.exception;

/**
 * 向量化失败或向量维度与项目固定维度不一致
 */
public class EmbeddingException extends NovelMemoryException {

    public EmbeddingException(String message) {
        super(message, "EMBEDDING_ERROR");
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, "EMBEDDING_ERROR", cause);
    }
}
