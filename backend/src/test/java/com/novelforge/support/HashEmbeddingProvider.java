package com.novelforge.support;

import com.novelforge.provider.EmbeddingProvider;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 确定性向量：字符与相邻字符对散列到固定维度后归一化，相同文本得到相同向量
 */
public class HashEmbeddingProvider implements EmbeddingProvider {

    private final int dimension;
    private final AtomicInteger calls = new AtomicInteger();

    public HashEmbeddingProvider(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        calls.incrementAndGet();
        float[] vector = new float[dimension];
        for (int i = 0; i < text.length(); i++) {
            vector[Math.floorMod(text.charAt(i) * 31, dimension)] += 1f;
            if (i + 1 < text.length()) {
                vector[Math.floorMod(text.substring(i, i + 2).hashCode(), dimension)] += 0.5f;
            }
        }
        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm == 0) {
            vector[0] = 1f;
            return vector;
        }
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < dimension; i++) {
            vector[i] *= scale;
        }
        return vector;
    }

    public int getCalls() {
        return calls.get();
    }
}
