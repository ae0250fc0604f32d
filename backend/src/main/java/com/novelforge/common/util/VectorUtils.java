package com.novelforge.common.util;

import com.novelforge.common.exception.EmbeddingException;

/**
 * 向量计算工具
 */
public final class VectorUtils {

    private VectorUtils() {
    }

    /**
     * 余弦相似度；任一向量为零向量时返回 0
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null) {
            throw new EmbeddingException("向量为空");
        }
        if (a.length != b.length) {
            throw new EmbeddingException("向量维度不一致: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    public static boolean isFinite(float[] vector) {
        for (float v : vector) {
            if (Float.isNaN(v) || Float.isInfinite(v)) {
                return false;
            }
        }
        return true;
    }
}
