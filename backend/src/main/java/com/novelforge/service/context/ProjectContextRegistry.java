package com.novelforge.service.context;

import com.novelforge.common.util.CollectionUtils;
import com.novelforge.config.MemoryProperties;
import com.novelforge.domain.entity.MemoryEntry;
import com.novelforge.model.MemoryKind;
import com.novelforge.provider.SummarizationProvider;
import com.novelforge.service.memory.LongTermMemoryStore;
import com.novelforge.service.support.CancellationToken;
import com.novelforge.service.support.ProviderCallRunner;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 项目上下文生命周期管理
 *
 * 首次访问时加载（从最新的滚动摘要记忆恢复），空闲超时后卸载；
 * 片段被挤出窗口时，与旧摘要一起交给摘要服务，生成的新摘要写入长期记忆
 */
@Component
public class ProjectContextRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ProjectContextRegistry.class);

    public static final String META_SUMMARY_TYPE = "summaryType";
    public static final String ROLLING_SUMMARY = "rolling";
    public static final String CHAPTER_SUMMARY = "chapter";

    private static final int SUMMARY_LOOKBACK = 50;

    private final Map<String, ProjectContext> contexts = new ConcurrentHashMap<>();

    private final LongTermMemoryStore memoryStore;
    private final SummarizationProvider summarizationProvider;
    private final ProviderCallRunner providerCallRunner;
    private final MemoryProperties properties;

    public ProjectContextRegistry(LongTermMemoryStore memoryStore,
                                  SummarizationProvider summarizationProvider,
                                  ProviderCallRunner providerCallRunner,
                                  MemoryProperties properties) {
        this.memoryStore = memoryStore;
        this.summarizationProvider = summarizationProvider;
        this.providerCallRunner = providerCallRunner;
        this.properties = properties;
    }

    public ProjectContext acquire(String projectId) {
        ProjectContext context = contexts.computeIfAbsent(projectId, this::load);
        context.touch();
        return context;
    }

    private ProjectContext load(String projectId) {
        String summary = null;
        for (MemoryEntry entry : memoryStore.list(projectId, MemoryKind.SUMMARY, SUMMARY_LOOKBACK)) {
            Object type = entry.getMetadata() != null ? entry.getMetadata().get(META_SUMMARY_TYPE) : null;
            if (ROLLING_SUMMARY.equals(type)) {
                summary = entry.getContent();
                break;
            }
        }
        logger.info("📂 加载项目上下文: project={}, 恢复滚动摘要={}", projectId, summary != null);
        return new ProjectContext(projectId, properties.getWindowSize(), summary);
    }

    /**
     * 追加已提交的原文片段；被挤出的片段逐段折叠进滚动摘要
     */
    public void appendSegment(String projectId, String segment) {
        if (StringUtils.isBlank(segment)) {
            return;
        }
        ProjectContext context = acquire(projectId);
        context.appendLock().lock();
        try {
            List<String> evicted = context.push(segment);
            for (String old : evicted) {
                foldIntoSummary(context, old);
            }
        } finally {
            context.appendLock().unlock();
        }
    }

    private void foldIntoSummary(ProjectContext context, String evicted) {
        String previous = context.getRollingSummary();
        String summary = providerCallRunner.call("滚动摘要", properties.getSummarizationTimeoutMs(),
            CancellationToken.none(), () -> summarizationProvider.summarize(evicted, previous));
        if (StringUtils.isBlank(summary)) {
            logger.warn("摘要服务返回空结果，保留原摘要: project={}", context.getProjectId());
            return;
        }
        memoryStore.add(context.getProjectId(), MemoryKind.SUMMARY, summary,
            CollectionUtils.mapOf(META_SUMMARY_TYPE, ROLLING_SUMMARY));
        context.setRollingSummary(summary);
        logger.info("🧾 片段已折叠进滚动摘要: project={}, summaryTokens={}",
            context.getProjectId(), TokenEstimator.estimate(summary));
    }

    /**
     * 定时卸载空闲的项目上下文；摘要已在折叠时持久化，卸载时无需写入
     */
    @Scheduled(fixedDelay = 60 * 1000)
    public void unloadIdle() {
        long now = System.currentTimeMillis();
        List<String> unloaded = new ArrayList<>();
        Iterator<Map.Entry<String, ProjectContext>> iterator = contexts.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, ProjectContext> entry = iterator.next();
            if (now - entry.getValue().getLastAccessMillis() > properties.getContextIdleMs()
                && !entry.getValue().appendLock().isLocked()) {
                iterator.remove();
                unloaded.add(entry.getKey());
            }
        }
        if (!unloaded.isEmpty()) {
            logger.info("💤 卸载空闲项目上下文: {}", unloaded);
        }
    }

    public void unload(String projectId) {
        if (contexts.remove(projectId) != null) {
            logger.info("卸载项目上下文: project={}", projectId);
        }
    }

    public Set<String> loadedProjects() {
        return contexts.keySet();
    }
}
