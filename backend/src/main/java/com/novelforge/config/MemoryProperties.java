package com.novelforge.config;

import com.novelforge.model.ReferencePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 记忆子系统配置（application.yml -> novel.memory.*）
 */
@Data
@Component
@ConfigurationProperties(prefix = "novel.memory")
public class MemoryProperties {

    /**
     * 持久化后端：jdbc / memory
     */
    private String persistence = "jdbc";

    /**
     * 默认向量维度，项目首次写入后固定
     */
    private int embeddingDimension = 384;

    private ReferencePolicy referencePolicy = ReferencePolicy.REJECT;

    /**
     * 相似度差值小于该值视为并列，按时间新者优先
     */
    private double tieEpsilon = 1e-6;

    private int defaultTopK = 5;

    /**
     * 滑动窗口保留的原文片段数
     */
    private int windowSize = 6;

    private int defaultTokenBudget = 4000;

    private int maxConsistencyRetries = 2;

    private int maxTransientAttempts = 3;

    private long backoffInitialMs = 200;

    private double backoffMultiplier = 2.0;

    private long generationTimeoutMs = 120_000;

    private long extractionTimeoutMs = 60_000;

    private long embeddingTimeoutMs = 30_000;

    private long summarizationTimeoutMs = 60_000;

    /**
     * 检索缓存有效期
     */
    private long cacheTtlMs = 300_000;

    /**
     * 项目上下文空闲多久后卸载
     */
    private long contextIdleMs = 1_800_000;

    /**
     * 一经确立不可改变的角色属性
     */
    private List<String> immutableAttributes = new ArrayList<>(
        Arrays.asList("gender", "species", "birthplace", "bloodline"));

    /**
     * 视为死亡的事件类型
     */
    private List<String> deathEventTypes = new ArrayList<>(
        Arrays.asList("death", "killed", "died", "死亡"));
}
