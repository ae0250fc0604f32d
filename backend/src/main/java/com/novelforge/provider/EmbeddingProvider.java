package com.novelforge.provider;

/**
 * 向量化服务：文本 → 固定维度向量
 */
public interface EmbeddingProvider {

    float[] embed(String text);
}
