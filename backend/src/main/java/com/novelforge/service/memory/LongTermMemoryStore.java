package com.novelforge.service.memory;

import com.novelforge.common.exception.EmbeddingException;
import com.novelforge.common.exception.NotFoundException;
import com.novelforge.common.exception.ReferenceException;
import com.novelforge.common.exception.ValidationException;
import com.novelforge.common.util.CollectionUtils;
import com.novelforge.common.util.VectorUtils;
import com.novelforge.config.MemoryProperties;
import com.novelforge.domain.entity.MemoryEntry;
import com.novelforge.domain.entity.ProjectMemoryState;
import com.novelforge.model.MemoryFilter;
import com.novelforge.model.MemoryKind;
import com.novelforge.model.NodeRef;
import com.novelforge.model.ReferencePolicy;
import com.novelforge.model.ScoredMemory;
import com.novelforge.persistence.GraphStore;
import com.novelforge.persistence.MemoryEntryStore;
import com.novelforge.persistence.ProjectStateStore;
import com.novelforge.persistence.TransactionRunner;
import com.novelforge.provider.EmbeddingProvider;
import com.novelforge.service.cache.RetrievalQueryCache;
import com.novelforge.service.graph.KnowledgeGraphService;
import com.novelforge.service.support.CancellationToken;
import com.novelforge.service.support.ProjectLockRegistry;
import com.novelforge.service.support.ProviderCallRunner;
import com.novelforge.service.support.TransientRetryExecutor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 长期记忆库
 *
 * 条目写入后不可修改，update 追加新版本；检索只看各版本链的最新版本，
 * 相似度差值在 tie-epsilon 以内时较新的条目优先
 *
 * 元数据交叉引用：
 * - nodeRefs: ["character:lihang", ...]，缺失时按 reference-policy 拒绝或自动创建占位节点
 * - nodeIds: 图谱节点ID，缺失时总是拒绝
 */
@Service
public class LongTermMemoryStore {

    private static final Logger logger = LoggerFactory.getLogger(LongTermMemoryStore.class);

    public static final String META_NODE_REFS = "nodeRefs";
    public static final String META_NODE_IDS = "nodeIds";

    private final MemoryEntryStore entryStore;
    private final GraphStore graphStore;
    private final ProjectStateStore stateStore;
    private final TransactionRunner transactionRunner;
    private final ProjectLockRegistry lockRegistry;
    private final KnowledgeGraphService graphService;
    private final EmbeddingProvider embeddingProvider;
    private final ProviderCallRunner providerCallRunner;
    private final RetrievalQueryCache queryCache;
    private final TransientRetryExecutor retryExecutor;
    private final MemoryProperties properties;

    public LongTermMemoryStore(MemoryEntryStore entryStore,
                               GraphStore graphStore,
                               ProjectStateStore stateStore,
                               TransactionRunner transactionRunner,
                               ProjectLockRegistry lockRegistry,
                               KnowledgeGraphService graphService,
                               EmbeddingProvider embeddingProvider,
                               ProviderCallRunner providerCallRunner,
                               RetrievalQueryCache queryCache,
                               TransientRetryExecutor retryExecutor,
                               MemoryProperties properties) {
        this.entryStore = entryStore;
        this.graphStore = graphStore;
        this.stateStore = stateStore;
        this.transactionRunner = transactionRunner;
        this.lockRegistry = lockRegistry;
        this.graphService = graphService;
        this.embeddingProvider = embeddingProvider;
        this.providerCallRunner = providerCallRunner;
        this.queryCache = queryCache;
        this.retryExecutor = retryExecutor;
        this.properties = properties;
    }

    // ==================== 写入 ====================

    /**
     * 新增记忆条目
     *
     * @param embedding 调用方已算好的向量，为空时调用向量化服务
     */
    public MemoryEntry add(String projectId, MemoryKind kind, String content,
                           Map<String, Object> metadata, float[] embedding) {
        PreparedMemory prepared = prepare(projectId, kind, content, metadata, embedding);
        MemoryEntry entry = retryExecutor.callStorage(() -> lockRegistry.withWriteLock(projectId, () ->
            transactionRunner.inTransaction(projectId, () -> insertPrepared(prepared))));
        queryCache.invalidateProject(projectId);
        logger.info("💾 新增记忆: project={}, kind={}, id={}", projectId, kind.getValue(), entry.getId());
        return entry.copy();
    }

    public MemoryEntry add(String projectId, MemoryKind kind, String content, Map<String, Object> metadata) {
        return add(projectId, kind, content, metadata, null);
    }

    /**
     * 校验请求并完成向量化，不加锁
     */
    public PreparedMemory prepare(String projectId, MemoryKind kind, String content,
                                  Map<String, Object> metadata, float[] embedding) {
        if (StringUtils.isBlank(projectId)) {
            throw new ValidationException("projectId不能为空");
        }
        if (kind == null) {
            throw new ValidationException("记忆类型不能为空");
        }
        if (StringUtils.isBlank(content)) {
            throw new ValidationException("记忆内容不能为空");
        }
        float[] vector = embedding != null ? embedding.clone() : embed(content);
        checkVector(vector);
        Map<String, Object> meta = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        return new PreparedMemory(projectId, kind, content, meta, vector);
    }

    /**
     * 在项目写事务内持久化已准备好的条目（版本1）
     */
    public MemoryEntry insertPrepared(PreparedMemory prepared) {
        String projectId = prepared.getProjectId();
        fixDimension(projectId, prepared.getEmbedding().length);
        validateReferences(projectId, prepared.getMetadata());

        String id = UUID.randomUUID().toString();
        MemoryEntry entry = MemoryEntry.builder()
            .id(id)
            .projectId(projectId)
            .kind(prepared.getKind())
            .content(prepared.getContent())
            .metadata(new LinkedHashMap<>(prepared.getMetadata()))
            .embedding(prepared.getEmbedding().clone())
            .version(1)
            .chainId(id)
            .previousVersionId(null)
            .createdAt(LocalDateTime.now())
            .build();
        entryStore.insert(entry);
        return entry;
    }

    /**
     * 追加新版本；元数据沿用上一版本，可通过 metadataChanges 覆盖
     */
    public MemoryEntry update(String entryId, String newContent, Map<String, Object> metadataChanges) {
        if (StringUtils.isBlank(newContent)) {
            throw new ValidationException("记忆内容不能为空");
        }
        MemoryEntry anchor = entryStore.findById(entryId)
            .orElseThrow(() -> new NotFoundException("记忆条目不存在: " + entryId));
        String projectId = anchor.getProjectId();
        float[] vector = embed(newContent);
        checkVector(vector);

        MemoryEntry next = retryExecutor.callStorage(() -> lockRegistry.withWriteLock(projectId, () ->
            transactionRunner.inTransaction(projectId, () -> {
                List<MemoryEntry> chain = entryStore.findChain(anchor.getChainId());
                MemoryEntry latest = chain.get(chain.size() - 1);
                Map<String, Object> metadata = new LinkedHashMap<>(
                    latest.getMetadata() != null ? latest.getMetadata() : Collections.emptyMap());
                if (metadataChanges != null) {
                    metadata.putAll(metadataChanges);
                }
                fixDimension(projectId, vector.length);
                validateReferences(projectId, metadata);

                MemoryEntry entry = MemoryEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .projectId(projectId)
                    .kind(latest.getKind())
                    .content(newContent)
                    .metadata(metadata)
                    .embedding(vector)
                    .version(latest.getVersion() + 1)
                    .chainId(latest.getChainId())
                    .previousVersionId(latest.getId())
                    .createdAt(LocalDateTime.now())
                    .build();
                entryStore.insert(entry);
                return entry;
            })));
        queryCache.invalidateProject(projectId);
        logger.info("📝 记忆新版本: project={}, chain={}, version={}", projectId, next.getChainId(), next.getVersion());
        return next.copy();
    }

    public MemoryEntry update(String entryId, String newContent) {
        return update(entryId, newContent, null);
    }

    /**
     * 显式回滚版本链：删除 version 之后的全部版本（唯一的物理删除）
     */
    public MemoryEntry rollback(String entryId, int version) {
        MemoryEntry anchor = entryStore.findById(entryId)
            .orElseThrow(() -> new NotFoundException("记忆条目不存在: " + entryId));
        String projectId = anchor.getProjectId();
        MemoryEntry target = retryExecutor.callStorage(() -> lockRegistry.withWriteLock(projectId, () ->
            transactionRunner.inTransaction(projectId, () -> {
                MemoryEntry found = entryStore.findChain(anchor.getChainId()).stream()
                    .filter(e -> e.getVersion() == version)
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("版本不存在: " + entryId + "@v" + version));
                int removed = entryStore.deleteChainAfter(anchor.getChainId(), version);
                logger.info("⏪ 记忆回滚: chain={}, toVersion={}, removed={}", anchor.getChainId(), version, removed);
                return found;
            })));
        queryCache.invalidateProject(projectId);
        return target;
    }

    // ==================== 读取 ====================

    /**
     * 版本链的最新版本
     */
    public Optional<MemoryEntry> get(String entryId) {
        return entryStore.findById(entryId)
            .map(anchor -> {
                List<MemoryEntry> chain = entryStore.findChain(anchor.getChainId());
                return chain.isEmpty() ? anchor : chain.get(chain.size() - 1);
            });
    }

    /**
     * 指定版本
     */
    public Optional<MemoryEntry> get(String entryId, int version) {
        return entryStore.findById(entryId)
            .flatMap(anchor -> entryStore.findChain(anchor.getChainId()).stream()
                .filter(e -> e.getVersion() == version)
                .findFirst());
    }

    public List<MemoryEntry> history(String entryId) {
        MemoryEntry anchor = entryStore.findById(entryId)
            .orElseThrow(() -> new NotFoundException("记忆条目不存在: " + entryId));
        return entryStore.findChain(anchor.getChainId());
    }

    /**
     * 按类型列出最新版本，按创建时间倒序
     */
    public List<MemoryEntry> list(String projectId, MemoryKind kind, int limit) {
        MemoryFilter filter = kind != null
            ? MemoryFilter.builder().kinds(CollectionUtils.setOf(kind)).build()
            : MemoryFilter.none();
        return entryStore.findLatest(projectId, filter, limit);
    }

    public Optional<MemoryEntry> latestSummary(String projectId) {
        List<MemoryEntry> summaries = list(projectId, MemoryKind.SUMMARY, 1);
        return summaries.isEmpty() ? Optional.empty() : Optional.of(summaries.get(0));
    }

    /**
     * 语义检索
     */
    public List<ScoredMemory> query(String projectId, String text, MemoryFilter filter, int topK) {
        if (StringUtils.isBlank(projectId)) {
            throw new ValidationException("projectId不能为空");
        }
        if (StringUtils.isBlank(text)) {
            throw new ValidationException("检索文本不能为空");
        }
        if (topK < 1) {
            throw new ValidationException("topK必须大于0");
        }
        MemoryFilter effective = filter != null ? filter : MemoryFilter.none();
        String cacheKey = queryCache.buildKey("query", text, effective.cacheKey(), topK);
        List<ScoredMemory> results = queryCache.getOrCompute(projectId, cacheKey,
            () -> search(projectId, text, effective, topK));
        return results.stream()
            .map(s -> new ScoredMemory(s.getEntry().copy(), s.getSimilarity()))
            .collect(Collectors.toList());
    }

    private List<ScoredMemory> search(String projectId, String text, MemoryFilter filter, int topK) {
        float[] vector = embed(text);
        checkVector(vector);
        Integer dimension = stateStore.load(projectId).getEmbeddingDimension();
        if (dimension == null) {
            return Collections.emptyList();
        }
        if (dimension != vector.length) {
            throw new EmbeddingException("检索向量维度不一致: 项目=" + dimension + ", 实际=" + vector.length);
        }

        // 多取一些候选，避免截断处的并列项被漏掉
        List<ScoredMemory> candidates = entryStore.nearest(projectId, vector, filter, topK * 4 + 16);
        List<ScoredMemory> ranked = rankWithRecency(candidates, properties.getTieEpsilon());
        List<ScoredMemory> top = ranked.size() > topK ? new ArrayList<>(ranked.subList(0, topK)) : ranked;
        logger.debug("🔍 记忆检索: project={}, candidates={}, returned={}", projectId, candidates.size(), top.size());
        return top;
    }

    /**
     * 相似度降序；与组首差值在 epsilon 以内的视为并列，组内按创建时间倒序
     */
    static List<ScoredMemory> rankWithRecency(List<ScoredMemory> candidates, double epsilon) {
        List<ScoredMemory> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingDouble(ScoredMemory::getSimilarity).reversed());

        Comparator<ScoredMemory> newerFirst = Comparator
            .comparing((ScoredMemory s) -> s.getEntry().getCreatedAt(), Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(s -> s.getEntry().getVersion(), Comparator.reverseOrder());

        List<ScoredMemory> ranked = new ArrayList<>();
        int i = 0;
        while (i < sorted.size()) {
            double head = sorted.get(i).getSimilarity();
            int j = i;
            while (j < sorted.size() && head - sorted.get(j).getSimilarity() <= epsilon) {
                j++;
            }
            List<ScoredMemory> group = new ArrayList<>(sorted.subList(i, j));
            group.sort(newerFirst);
            ranked.addAll(group);
            i = j;
        }
        return ranked;
    }

    public Integer embeddingDimension(String projectId) {
        return stateStore.load(projectId).getEmbeddingDimension();
    }

    // ==================== 内部 ====================

    private float[] embed(String text) {
        try {
            return providerCallRunner.call("向量化", properties.getEmbeddingTimeoutMs(), CancellationToken.none(),
                () -> embeddingProvider.embed(text));
        } catch (RestClientException e) {
            throw new EmbeddingException("向量化服务调用失败: " + e.getMessage(), e);
        }
    }

    private void checkVector(float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new EmbeddingException("向量为空");
        }
        if (!VectorUtils.isFinite(vector)) {
            throw new EmbeddingException("向量包含非法数值");
        }
    }

    /**
     * 项目首次写入时固定向量维度（未配置时以首个向量为准），之后维度不一致一律拒绝
     */
    private void fixDimension(String projectId, int length) {
        ProjectMemoryState state = stateStore.load(projectId);
        Integer dimension = state.getEmbeddingDimension();
        if (dimension == null) {
            int expected = properties.getEmbeddingDimension();
            if (expected > 0 && expected != length) {
                throw new EmbeddingException("向量维度不一致: 配置=" + expected + ", 实际=" + length);
            }
            state.setEmbeddingDimension(length);
            state.setUpdatedAt(LocalDateTime.now());
            stateStore.save(state);
            logger.info("📐 项目向量维度已固定: project={}, dimension={}", projectId, length);
            return;
        }
        if (dimension != length) {
            throw new EmbeddingException("向量维度不一致: 项目=" + dimension + ", 实际=" + length);
        }
    }

    private void validateReferences(String projectId, Map<String, Object> metadata) {
        for (String raw : CollectionUtils.toStringList(metadata.get(META_NODE_REFS))) {
            NodeRef ref = NodeRef.parse(raw);
            if (graphStore.findNode(projectId, ref.getType(), ref.getKey()).isPresent()) {
                continue;
            }
            if (properties.getReferencePolicy() == ReferencePolicy.AUTO_CREATE) {
                graphService.ensurePlaceholder(projectId, ref);
            } else {
                throw new ReferenceException("记忆引用的图谱节点不存在: " + ref);
            }
        }
        for (String nodeId : CollectionUtils.toStringList(metadata.get(META_NODE_IDS))) {
            if (!graphStore.findNodeById(projectId, nodeId).isPresent()) {
                throw new ReferenceException("记忆引用的图谱节点ID不存在: " + nodeId);
            }
        }
    }
}
