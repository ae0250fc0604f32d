package com.novelforge.service.memory;

import com.novelforge.common.exception.ValidationException;
import com.novelforge.common.util.CollectionUtils;
import com.novelforge.config.MemoryProperties;
import com.novelforge.domain.entity.KnowledgeNode;
import com.novelforge.domain.entity.MemoryEntry;
import com.novelforge.model.GraphSnapshot;
import com.novelforge.model.MemoryKind;
import com.novelforge.model.NodeRef;
import com.novelforge.model.NodeType;
import com.novelforge.model.ScoredMemory;
import com.novelforge.persistence.TransactionRunner;
import com.novelforge.service.cache.RetrievalQueryCache;
import com.novelforge.service.context.GraphFactFormatter;
import com.novelforge.service.context.ProjectContextRegistry;
import com.novelforge.service.graph.KnowledgeGraphService;
import com.novelforge.service.support.ProjectLockRegistry;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 叙事记忆门面：设定类写入同时落图谱节点和记忆条目（同一事务），
 * 并提供面向提示词的上下文汇总
 */
@Service
public class NarrativeMemoryFacade {

    private static final Logger logger = LoggerFactory.getLogger(NarrativeMemoryFacade.class);

    public static final String RELATION_PARTICIPATES_IN = "PARTICIPATES_IN";
    public static final String RELATION_OCCURRED_AT = "OCCURRED_AT";

    private final LongTermMemoryStore memoryStore;
    private final KnowledgeGraphService graphService;
    private final TransactionRunner transactionRunner;
    private final ProjectLockRegistry lockRegistry;
    private final RetrievalQueryCache queryCache;
    private final MemoryProperties properties;

    public NarrativeMemoryFacade(LongTermMemoryStore memoryStore,
                                 KnowledgeGraphService graphService,
                                 TransactionRunner transactionRunner,
                                 ProjectLockRegistry lockRegistry,
                                 RetrievalQueryCache queryCache,
                                 MemoryProperties properties) {
        this.memoryStore = memoryStore;
        this.graphService = graphService;
        this.transactionRunner = transactionRunner;
        this.lockRegistry = lockRegistry;
        this.queryCache = queryCache;
        this.properties = properties;
    }

    /**
     * 添加角色：角色节点 + 角色状态记忆
     */
    public MemoryEntry addCharacter(String projectId, String key, Map<String, Object> attributes, String description) {
        requireKey(key, "角色");
        Map<String, Object> attrs = attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>();
        String content = StringUtils.isNotBlank(description)
            ? description : "角色 " + key + (attrs.isEmpty() ? "" : " " + attrs);
        NodeRef ref = NodeRef.of(NodeType.CHARACTER, key);
        return writeWithNode(projectId, ref, attrs, MemoryKind.CHARACTER_STATE, content,
            CollectionUtils.mapOf("name", key));
    }

    public MemoryEntry addLocation(String projectId, String key, Map<String, Object> attributes, String description) {
        requireKey(key, "地点");
        Map<String, Object> attrs = attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>();
        String content = StringUtils.isNotBlank(description) ? description : "地点 " + key;
        return writeWithNode(projectId, NodeRef.of(NodeType.LOCATION, key), attrs, MemoryKind.WORLDBUILDING, content,
            CollectionUtils.mapOf("name", key, "category", "location"));
    }

    /**
     * 添加世界规则；forbiddenActions 中的动作在一致性校验时视为违反规则
     */
    public MemoryEntry addRule(String projectId, String key, String description, List<String> forbiddenActions) {
        requireKey(key, "规则");
        if (StringUtils.isBlank(description)) {
            throw new ValidationException("规则描述不能为空");
        }
        Map<String, Object> attrs = CollectionUtils.mapOf("description", description);
        if (forbiddenActions != null && !forbiddenActions.isEmpty()) {
            attrs.put("forbiddenActions", new ArrayList<>(forbiddenActions));
        }
        return writeWithNode(projectId, NodeRef.of(NodeType.RULE, key), attrs, MemoryKind.WORLDBUILDING,
            description, CollectionUtils.mapOf("name", key, "category", "rule"));
    }

    /**
     * 添加事件：事件节点 + 参与者关系 + 事件记忆；死亡类事件同时把主体角色标记为死亡
     */
    public MemoryEntry addEvent(String projectId, String key, String eventType, List<String> participants,
                                long sequence, String description, boolean flashback) {
        requireKey(key, "事件");
        if (StringUtils.isBlank(eventType)) {
            throw new ValidationException("事件类型不能为空");
        }
        if (StringUtils.isBlank(description)) {
            throw new ValidationException("事件描述不能为空");
        }
        List<String> actors = participants != null ? new ArrayList<>(participants) : new ArrayList<>();
        NodeRef eventRef = NodeRef.of(NodeType.EVENT, key);
        Map<String, Object> eventAttrs = CollectionUtils.mapOf(
            "eventType", eventType,
            "participants", actors,
            "sequence", sequence,
            "flashback", flashback,
            "description", description);

        List<String> nodeRefs = new ArrayList<>();
        nodeRefs.add(eventRef.toString());
        for (String actor : actors) {
            nodeRefs.add(NodeRef.of(NodeType.CHARACTER, actor).toString());
        }
        Map<String, Object> metadata = CollectionUtils.mapOf(
            LongTermMemoryStore.META_NODE_REFS, nodeRefs,
            "eventType", eventType,
            "sequence", sequence);
        PreparedMemory prepared = memoryStore.prepare(projectId, MemoryKind.EVENT, description, metadata, null);

        MemoryEntry entry = lockRegistry.withWriteLock(projectId, () -> transactionRunner.inTransaction(projectId, () -> {
            graphService.upsertNode(projectId, NodeType.EVENT, key, eventAttrs);
            for (String actor : actors) {
                NodeRef actorRef = NodeRef.of(NodeType.CHARACTER, actor);
                graphService.ensurePlaceholder(projectId, actorRef);
                graphService.addEdge(projectId, actorRef, eventRef, RELATION_PARTICIPATES_IN,
                    CollectionUtils.mapOf("sequence", sequence));
            }
            if (isDeathType(eventType) && !flashback && !actors.isEmpty()) {
                graphService.upsertNode(projectId, NodeType.CHARACTER, actors.get(0), CollectionUtils.mapOf(
                    "alive", false, "deathEvent", key, "deathSequence", sequence));
            }
            return memoryStore.insertPrepared(prepared);
        }));
        queryCache.invalidateProject(projectId);
        logger.info("📅 添加事件: project={}, event={}, type={}, seq={}", projectId, key, eventType, sequence);
        return entry.copy();
    }

    public MemoryEntry addChapterSummary(String projectId, int chapterNumber, String title, String summary) {
        if (chapterNumber < 1) {
            throw new ValidationException("chapterNumber必须大于0");
        }
        if (StringUtils.isBlank(summary)) {
            throw new ValidationException("章节摘要不能为空");
        }
        Map<String, Object> metadata = CollectionUtils.mapOf(
            ProjectContextRegistry.META_SUMMARY_TYPE, ProjectContextRegistry.CHAPTER_SUMMARY,
            "chapter", chapterNumber,
            "title", title);
        String content = "第" + chapterNumber + "章" + (StringUtils.isNotBlank(title) ? "《" + title + "》" : "")
            + "：" + summary;
        return memoryStore.add(projectId, MemoryKind.SUMMARY, content, metadata);
    }

    /**
     * 为生成汇总上下文：检索到的记忆 + 记忆关联实体的图谱事实
     */
    public String getContextForGeneration(String projectId, String query, int topK) {
        List<ScoredMemory> memories = memoryStore.query(projectId, query, null,
            topK > 0 ? topK : properties.getDefaultTopK());
        GraphSnapshot view = graphService.readView(projectId);

        Set<String> seeds = new LinkedHashSet<>();
        StringBuilder sb = new StringBuilder();
        if (!memories.isEmpty()) {
            sb.append("【相关记忆】\n");
            for (ScoredMemory memory : memories) {
                sb.append("- [").append(memory.getEntry().getKind().getValue()).append("] ")
                    .append(memory.getEntry().getContent()).append("\n");
                Object refs = memory.getEntry().getMetadata() != null
                    ? memory.getEntry().getMetadata().get(LongTermMemoryStore.META_NODE_REFS) : null;
                seeds.addAll(CollectionUtils.toStringList(refs));
            }
        }
        List<String> facts = seeds.isEmpty()
            ? Collections.<String>emptyList()
            : GraphFactFormatter.format(graphService.querySubgraph(view, seeds, 0));
        if (!facts.isEmpty()) {
            if (sb.length() > 0) {
                sb.append("\n");
            }
            sb.append("【图谱事实】\n");
            for (String fact : facts) {
                sb.append(fact).append("\n");
            }
        }
        return sb.toString().trim();
    }

    private MemoryEntry writeWithNode(String projectId, NodeRef ref, Map<String, Object> attrs,
                                      MemoryKind kind, String content, Map<String, Object> extraMetadata) {
        Map<String, Object> metadata = new LinkedHashMap<>(extraMetadata);
        metadata.put(LongTermMemoryStore.META_NODE_REFS, CollectionUtils.listOf(ref.toString()));
        PreparedMemory prepared = memoryStore.prepare(projectId, kind, content, metadata, null);

        MemoryEntry entry = lockRegistry.withWriteLock(projectId, () -> transactionRunner.inTransaction(projectId, () -> {
            KnowledgeNode node = graphService.upsertNode(projectId, ref.getType(), ref.getKey(), attrs);
            logger.debug("节点已写入: ref={}, version={}", ref, node.getVersion());
            return memoryStore.insertPrepared(prepared);
        }));
        queryCache.invalidateProject(projectId);
        logger.info("💾 添加{}: project={}, key={}", ref.getType().getValue(), projectId, ref.getKey());
        return entry.copy();
    }

    private boolean isDeathType(String eventType) {
        for (String type : properties.getDeathEventTypes()) {
            if (type.equalsIgnoreCase(eventType.trim())) {
                return true;
            }
        }
        return false;
    }

    private void requireKey(String key, String label) {
        if (StringUtils.isBlank(key)) {
            throw new ValidationException(label + "键不能为空");
        }
    }
}
