package com.novelforge.service.cache;

import com.novelforge.config.MemoryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 检索查询缓存
 *
 * 策略：
 * 1. 按项目缓存重复的检索结果（默认5分钟有效期）
 * 2. 项目记忆或图谱发生任何写入后整体失效
 * 3. 定时清理过期缓存
 *
 * 每个项目维护一个代数，写入时递增；计算期间发生写入的结果不入缓存
 */
@Component
public class RetrievalQueryCache {

    private static final Logger logger = LoggerFactory.getLogger(RetrievalQueryCache.class);

    private final long ttlMs;

    private final Map<String, Map<String, CacheEntry>> cache = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> generations = new ConcurrentHashMap<>();

    public RetrievalQueryCache(MemoryProperties properties) {
        this.ttlMs = properties.getCacheTtlMs();
    }

    /**
     * 命中则返回缓存，否则计算并在项目未被写入的前提下缓存结果
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(String projectId, String key, Supplier<T> loader) {
        Map<String, CacheEntry> projectCache = cache.get(projectId);
        if (projectCache != null) {
            CacheEntry entry = projectCache.get(key);
            if (entry != null) {
                if (entry.generation == generation(projectId).get()
                    && System.currentTimeMillis() - entry.timestamp <= ttlMs) {
                    logger.debug("缓存命中: project={}, key={}", projectId, key);
                    return (T) entry.data;
                }
                projectCache.remove(key, entry);
            }
        }

        long generation = generation(projectId).get();
        T data = loader.get();
        // 代数校验与写入在同一个 compute 内完成，与 invalidateProject 互斥
        cache.compute(projectId, (k, current) -> {
            if (generation(projectId).get() != generation) {
                return current;
            }
            Map<String, CacheEntry> target = current != null ? current : new ConcurrentHashMap<>();
            CacheEntry entry = new CacheEntry();
            entry.timestamp = System.currentTimeMillis();
            entry.generation = generation;
            entry.data = data;
            target.put(key, entry);
            return target;
        });
        return data;
    }

    /**
     * 构建查询键
     */
    public String buildKey(String queryType, Object... params) {
        StringBuilder key = new StringBuilder(queryType);
        for (Object param : params) {
            key.append(":").append(param);
        }
        return key.toString();
    }

    /**
     * 失效项目的所有缓存
     */
    public void invalidateProject(String projectId) {
        AtomicLong generation = generation(projectId);
        cache.compute(projectId, (k, current) -> {
            generation.incrementAndGet();
            if (current != null && !current.isEmpty()) {
                logger.debug("失效项目缓存: projectId={}, entries={}", projectId, current.size());
            }
            return null;
        });
    }

    /**
     * 定时清理过期缓存
     */
    @Scheduled(fixedRate = 10 * 60 * 1000)
    public void cleanExpiredCache() {
        long now = System.currentTimeMillis();
        int removedCount = 0;

        for (Map<String, CacheEntry> projectCache : cache.values()) {
            Iterator<Map.Entry<String, CacheEntry>> iterator = projectCache.entrySet().iterator();
            while (iterator.hasNext()) {
                if (now - iterator.next().getValue().timestamp > ttlMs) {
                    iterator.remove();
                    removedCount++;
                }
            }
        }

        if (removedCount > 0) {
            logger.info("清理过期缓存: 移除{}个条目", removedCount);
        }
    }

    /**
     * 获取缓存统计
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("projects", cache.size());
        stats.put("totalEntries", cache.values().stream().mapToInt(Map::size).sum());
        return stats;
    }

    private AtomicLong generation(String projectId) {
        return generations.computeIfAbsent(projectId, k -> new AtomicLong());
    }

    /**
     * 缓存条目
     */
    private static class CacheEntry {
        long timestamp;
        long generation;
        Object data;
    }
}
