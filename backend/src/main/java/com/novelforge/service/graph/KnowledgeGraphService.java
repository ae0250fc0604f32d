package com.novelforge.service.graph;

import com.novelforge.common.exception.MissingNodeException;
import com.novelforge.common.exception.NotFoundException;
import com.novelforge.common.exception.ValidationException;
import com.novelforge.common.util.AttributeValues;
import com.novelforge.common.util.CollectionUtils;
import com.novelforge.domain.entity.KnowledgeEdge;
import com.novelforge.domain.entity.KnowledgeNode;
import com.novelforge.domain.entity.ProjectMemoryState;
import com.novelforge.domain.entity.ProposalAudit;
import com.novelforge.model.GraphSnapshot;
import com.novelforge.model.NodeRef;
import com.novelforge.model.NodeType;
import com.novelforge.model.StagedEdge;
import com.novelforge.model.StagedGraphChanges;
import com.novelforge.model.StagedNodeUpsert;
import com.novelforge.model.Subgraph;
import com.novelforge.persistence.GraphStore;
import com.novelforge.persistence.ProjectStateStore;
import com.novelforge.persistence.TransactionRunner;
import com.novelforge.service.cache.RetrievalQueryCache;
import com.novelforge.service.support.ProjectLockRegistry;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 知识图谱服务
 *
 * 节点按 (project, type, key) 幂等写入，属性变化时版本递增；边的两端必须已存在；
 * 项目图谱版本在每次改变图谱的写入/提交/回滚后递增一次
 */
@Service
public class KnowledgeGraphService {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeGraphService.class);

    public static final String PLACEHOLDER_ATTRIBUTE = "placeholder";

    private final GraphStore graphStore;
    private final ProjectStateStore stateStore;
    private final TransactionRunner transactionRunner;
    private final ProjectLockRegistry lockRegistry;
    private final RetrievalQueryCache queryCache;

    public KnowledgeGraphService(GraphStore graphStore,
                                 ProjectStateStore stateStore,
                                 TransactionRunner transactionRunner,
                                 ProjectLockRegistry lockRegistry,
                                 RetrievalQueryCache queryCache) {
        this.graphStore = graphStore;
        this.stateStore = stateStore;
        this.transactionRunner = transactionRunner;
        this.lockRegistry = lockRegistry;
        this.queryCache = queryCache;
    }

    // ==================== 写入 ====================

    /**
     * 幂等写入节点；属性值为 null 表示删除该属性
     */
    public KnowledgeNode upsertNode(String projectId, NodeType type, String key, Map<String, Object> attributes) {
        requireProject(projectId);
        NodeRef ref = NodeRef.of(type, key);
        Map<String, Object> attrs = attributes != null ? attributes : new LinkedHashMap<>();

        GraphWriteOutcome<KnowledgeNode> outcome = write(projectId, () -> {
            GraphWriteOutcome<KnowledgeNode> o = applyUpsert(projectId, ref, attrs);
            if (o.isChanged()) {
                bumpVersion(projectId);
            }
            return o;
        });

        if (outcome.isCreated()) {
            logger.info("➕ 新建节点: project={}, ref={}", projectId, ref);
        } else if (outcome.isChanged()) {
            logger.info("✏️ 节点更新: project={}, ref={}, version={}", projectId, ref, outcome.getValue().getVersion());
        } else {
            logger.debug("节点属性未变化，跳过: project={}, ref={}", projectId, ref);
        }
        return outcome.getValue();
    }

    public KnowledgeEdge addEdge(String projectId, NodeRef source, NodeRef target,
                                 String relation, Map<String, Object> attributes) {
        requireProject(projectId);
        if (source == null || target == null) {
            throw new ValidationException("关系两端节点不能为空");
        }
        if (StringUtils.isBlank(relation)) {
            throw new ValidationException("关系类型不能为空");
        }
        Map<String, Object> attrs = attributes != null ? attributes : new LinkedHashMap<>();

        GraphWriteOutcome<KnowledgeEdge> outcome = write(projectId, () -> {
            GraphWriteOutcome<KnowledgeEdge> o = applyEdge(projectId, source, target, relation.trim(), attrs);
            if (o.isChanged()) {
                bumpVersion(projectId);
            }
            return o;
        });
        if (outcome.isCreated()) {
            logger.info("🔗 新建关系: project={}, {} -[{}]-> {}", projectId, source, relation, target);
        }
        return outcome.getValue();
    }

    /**
     * 为悬空引用创建占位节点；必须在项目写事务内调用
     */
    public KnowledgeNode ensurePlaceholder(String projectId, NodeRef ref) {
        Optional<KnowledgeNode> existing = graphStore.findNode(projectId, ref.getType(), ref.getKey());
        if (existing.isPresent()) {
            return existing.get();
        }
        GraphWriteOutcome<KnowledgeNode> outcome =
            applyUpsert(projectId, ref, CollectionUtils.mapOf(PLACEHOLDER_ATTRIBUTE, true));
        bumpVersion(projectId);
        logger.info("📌 自动创建占位节点: project={}, ref={}", projectId, ref);
        return outcome.getValue();
    }

    /**
     * 提交阶段应用暂存的图谱变更；必须在项目写事务内调用
     *
     * 节点自请求开始后已被其他请求修改、且本次写入覆盖了不同的已提交值时，
     * 以最后提交者为准，并记录被覆盖的值
     *
     * @return 图谱是否发生变化
     */
    public boolean applyStagedChanges(String projectId, String requestId, StagedGraphChanges changes) {
        boolean changed = false;
        for (StagedNodeUpsert upsert : changes.getNodeUpserts()) {
            NodeRef ref = upsert.getRef();
            Optional<KnowledgeNode> current = graphStore.findNode(projectId, ref.getType(), ref.getKey());
            current.ifPresent(node -> recordOverwrites(projectId, requestId, upsert, node));
            changed |= applyUpsert(projectId, ref, upsert.getAttributes()).isChanged();
        }
        for (StagedEdge edge : changes.getEdges()) {
            changed |= applyEdge(projectId, edge.getSource(), edge.getTarget(),
                edge.getRelation(), edge.getAttributes()).isChanged();
        }
        return changed;
    }

    /**
     * 项目图谱版本 +1；必须在项目写事务内调用
     */
    public long bumpVersion(String projectId) {
        ProjectMemoryState state = stateStore.load(projectId);
        long next = (state.getGraphVersion() != null ? state.getGraphVersion() : 0L) + 1;
        state.setGraphVersion(next);
        state.setUpdatedAt(LocalDateTime.now());
        stateStore.save(state);
        return next;
    }

    GraphWriteOutcome<KnowledgeNode> applyUpsert(String projectId, NodeRef ref, Map<String, Object> attributes) {
        LocalDateTime now = LocalDateTime.now();
        Optional<KnowledgeNode> existing = graphStore.findNode(projectId, ref.getType(), ref.getKey());
        if (!existing.isPresent()) {
            KnowledgeNode node = KnowledgeNode.builder()
                .id(UUID.randomUUID().toString())
                .projectId(projectId)
                .type(ref.getType())
                .nodeKey(ref.getKey())
                .attributes(merge(new LinkedHashMap<>(), attributes))
                .version(1)
                .createdAt(now)
                .updatedAt(now)
                .build();
            graphStore.insertNode(node);
            return new GraphWriteOutcome<>(node, true, true);
        }

        KnowledgeNode node = existing.get();
        Map<String, Object> current = node.getAttributes() != null ? node.getAttributes() : new LinkedHashMap<>();
        Map<String, Object> merged = merge(new LinkedHashMap<>(current), attributes);
        // 实体被正式写入后不再是占位节点
        if (AttributeValues.isTrue(current.get(PLACEHOLDER_ATTRIBUTE))
            && !attributes.containsKey(PLACEHOLDER_ATTRIBUTE) && !attributes.isEmpty()) {
            merged.remove(PLACEHOLDER_ATTRIBUTE);
        }
        if (AttributeValues.sameAttributes(merged, current)) {
            return new GraphWriteOutcome<>(node, false, false);
        }
        node.setAttributes(merged);
        node.setVersion(node.getVersion() + 1);
        node.setUpdatedAt(now);
        graphStore.updateNode(node);
        return new GraphWriteOutcome<>(node, false, true);
    }

    GraphWriteOutcome<KnowledgeEdge> applyEdge(String projectId, NodeRef source, NodeRef target,
                                               String relation, Map<String, Object> attributes) {
        KnowledgeNode sourceNode = graphStore.findNode(projectId, source.getType(), source.getKey())
            .orElseThrow(() -> new MissingNodeException(source.toString()));
        KnowledgeNode targetNode = graphStore.findNode(projectId, target.getType(), target.getKey())
            .orElseThrow(() -> new MissingNodeException(target.toString()));

        Optional<KnowledgeEdge> existing =
            graphStore.findEdge(projectId, sourceNode.getId(), targetNode.getId(), relation);
        if (existing.isPresent()) {
            KnowledgeEdge edge = existing.get();
            Map<String, Object> current = edge.getAttributes() != null ? edge.getAttributes() : new LinkedHashMap<>();
            Map<String, Object> merged = merge(new LinkedHashMap<>(current), attributes);
            if (AttributeValues.sameAttributes(merged, current)) {
                return new GraphWriteOutcome<>(edge, false, false);
            }
            edge.setAttributes(merged);
            graphStore.updateEdge(edge);
            return new GraphWriteOutcome<>(edge, false, true);
        }

        KnowledgeEdge edge = KnowledgeEdge.builder()
            .id(UUID.randomUUID().toString())
            .projectId(projectId)
            .sourceId(sourceNode.getId())
            .targetId(targetNode.getId())
            .relation(relation)
            .attributes(merge(new LinkedHashMap<>(), attributes))
            .createdAt(LocalDateTime.now())
            .build();
        graphStore.insertEdge(edge);
        return new GraphWriteOutcome<>(edge, true, true);
    }

    private void recordOverwrites(String projectId, String requestId, StagedNodeUpsert upsert, KnowledgeNode current) {
        Integer base = upsert.getBaseVersion();
        if (base != null && base.equals(current.getVersion())) {
            return;
        }
        Map<String, Object> committed = current.getAttributes() != null ? current.getAttributes() : Collections.emptyMap();
        Map<String, Object> overwritten = new LinkedHashMap<>();
        Map<String, Object> applied = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : upsert.getAttributes().entrySet()) {
            Object committedValue = committed.get(entry.getKey());
            if (committedValue != null && !AttributeValues.same(committedValue, entry.getValue())) {
                overwritten.put(entry.getKey(), committedValue);
                applied.put(entry.getKey(), entry.getValue());
            }
        }
        if (overwritten.isEmpty()) {
            return;
        }
        graphStore.insertAudit(ProposalAudit.builder()
            .id(UUID.randomUUID().toString())
            .projectId(projectId)
            .winningRequestId(requestId)
            .nodeRef(upsert.getRef().toString())
            .baseVersion(base)
            .committedVersion(current.getVersion())
            .overwrittenValues(overwritten)
            .appliedValues(applied)
            .createdAt(LocalDateTime.now())
            .build());
        logger.warn("⚖️ 并发提案冲突，以最后提交为准: project={}, ref={}, request={}, overwritten={}",
            projectId, upsert.getRef(), requestId, overwritten.keySet());
    }

    private Map<String, Object> merge(Map<String, Object> target, Map<String, Object> changes) {
        for (Map.Entry<String, Object> entry : changes.entrySet()) {
            if (entry.getValue() == null) {
                target.remove(entry.getKey());
            } else {
                target.put(entry.getKey(), entry.getValue());
            }
        }
        return target;
    }

    // ==================== 快照与回滚 ====================

    /**
     * 持久化当前图谱的完整拷贝
     */
    public GraphSnapshot snapshot(String projectId) {
        requireProject(projectId);
        GraphSnapshot snapshot = lockRegistry.withWriteLock(projectId, () ->
            transactionRunner.inTransaction(projectId, () -> {
                GraphSnapshot view = graphStore.readView(projectId);
                GraphSnapshot persisted = new GraphSnapshot(UUID.randomUUID().toString(), projectId,
                    view.getGraphVersion(), view.getNodes(), view.getEdges(), LocalDateTime.now());
                graphStore.saveSnapshot(persisted);
                return persisted;
            }));
        logger.info("📸 图谱快照: project={}, snapshot={}, version={}, nodes={}, edges={}",
            projectId, snapshot.getId(), snapshot.getGraphVersion(), snapshot.nodeCount(), snapshot.edgeCount());
        return snapshot;
    }

    /**
     * 回滚到指定快照：节点与边恢复为快照时的状态，之后的版本全部丢弃
     *
     * @return 回滚后的项目图谱版本
     */
    public long rollback(String projectId, String snapshotId) {
        requireProject(projectId);
        long version = write(projectId, () -> {
            GraphSnapshot snapshot = graphStore.findSnapshot(projectId, snapshotId)
                .orElseThrow(() -> new NotFoundException("图谱快照不存在: " + snapshotId));
            graphStore.replaceGraph(projectId, snapshot.getNodes(), snapshot.getEdges());
            return bumpVersion(projectId);
        });
        logger.info("⏪ 图谱已回滚: project={}, snapshot={}, newVersion={}", projectId, snapshotId, version);
        return version;
    }

    public List<GraphSnapshot> listSnapshots(String projectId) {
        return graphStore.listSnapshots(projectId);
    }

    // ==================== 查询 ====================

    /**
     * 请求级只读视图（快照隔离）
     */
    public GraphSnapshot readView(String projectId) {
        return graphStore.readView(projectId);
    }

    public long graphVersion(String projectId) {
        Long version = stateStore.load(projectId).getGraphVersion();
        return version != null ? version : 0L;
    }

    public Optional<KnowledgeNode> findNode(String projectId, NodeRef ref) {
        return graphStore.findNode(projectId, ref.getType(), ref.getKey());
    }

    public List<KnowledgeNode> listNodes(String projectId, NodeType type) {
        return graphStore.listNodes(projectId, type);
    }

    /**
     * 节点的全部关系（出边与入边）
     */
    public List<KnowledgeEdge> relationships(String projectId, NodeRef ref) {
        KnowledgeNode node = findNode(projectId, ref).orElseThrow(() -> new MissingNodeException(ref.toString()));
        return graphStore.edgesTouching(projectId, Collections.singleton(node.getId()));
    }

    public Subgraph querySubgraph(String projectId, Collection<String> seedKeys, int depth) {
        return querySubgraph(readView(projectId), seedKeys, depth);
    }

    /**
     * 从种子节点出发做有界广度优先遍历（双向），返回诱导子图
     *
     * 种子可以是 type:key 或裸 key（匹配所有类型）；不存在的种子忽略
     */
    public Subgraph querySubgraph(GraphSnapshot view, Collection<String> seedKeys, int depth) {
        if (depth < 0) {
            throw new ValidationException("遍历深度不能为负数: " + depth);
        }
        List<KnowledgeNode> allNodes = view.getNodes();
        List<KnowledgeEdge> allEdges = view.getEdges();

        Set<String> visited = new LinkedHashSet<>();
        Deque<String> frontier = new ArrayDeque<>();
        for (String seed : seedKeys != null ? seedKeys : Collections.<String>emptyList()) {
            for (String nodeId : resolveSeed(view, allNodes, seed)) {
                if (visited.add(nodeId)) {
                    frontier.add(nodeId);
                }
            }
        }

        Map<String, List<String>> adjacency = new HashMap<>();
        for (KnowledgeEdge edge : allEdges) {
            adjacency.computeIfAbsent(edge.getSourceId(), k -> new ArrayList<>()).add(edge.getTargetId());
            adjacency.computeIfAbsent(edge.getTargetId(), k -> new ArrayList<>()).add(edge.getSourceId());
        }

        for (int hop = 0; hop < depth && !frontier.isEmpty(); hop++) {
            Deque<String> next = new ArrayDeque<>();
            for (String nodeId : frontier) {
                for (String neighbour : adjacency.getOrDefault(nodeId, Collections.emptyList())) {
                    if (visited.add(neighbour)) {
                        next.add(neighbour);
                    }
                }
            }
            frontier = next;
        }

        List<KnowledgeNode> nodes = new ArrayList<>();
        for (String nodeId : visited) {
            view.findNodeById(nodeId).ifPresent(nodes::add);
        }
        List<KnowledgeEdge> edges = allEdges.stream()
            .filter(e -> visited.contains(e.getSourceId()) && visited.contains(e.getTargetId()))
            .collect(Collectors.toList());
        return new Subgraph(nodes, edges);
    }

    private List<String> resolveSeed(GraphSnapshot view, List<KnowledgeNode> allNodes, String seed) {
        if (StringUtils.isBlank(seed)) {
            return Collections.emptyList();
        }
        if (NodeRef.isQualified(seed)) {
            return view.findNode(NodeRef.parse(seed))
                .map(n -> Collections.singletonList(n.getId()))
                .orElse(Collections.emptyList());
        }
        String key = seed.trim();
        return allNodes.stream()
            .filter(n -> n.getNodeKey().equals(key))
            .map(KnowledgeNode::getId)
            .collect(Collectors.toList());
    }

    /**
     * 获取图谱统计信息
     */
    public Map<String, Object> getGraphStatistics(String projectId) {
        GraphSnapshot view = readView(projectId);
        Map<String, Long> byType = new TreeMap<>();
        for (KnowledgeNode node : view.getNodes()) {
            byType.merge(node.getType().getValue(), 1L, Long::sum);
        }
        Map<String, Long> byRelation = new TreeMap<>();
        for (KnowledgeEdge edge : view.getEdges()) {
            byRelation.merge(edge.getRelation(), 1L, Long::sum);
        }
        return CollectionUtils.mapOf(
            "projectId", projectId,
            "graphVersion", view.getGraphVersion(),
            "nodeCount", view.nodeCount(),
            "edgeCount", view.edgeCount(),
            "nodesByType", byType,
            "edgesByRelation", byRelation,
            "snapshotCount", graphStore.listSnapshots(projectId).size());
    }

    /**
     * 导出为 Cytoscape.js 格式：{"elements":[{"data":{...}}]}
     */
    public Map<String, Object> exportCytoscape(String projectId) {
        GraphSnapshot view = readView(projectId);
        List<Map<String, Object>> elements = new ArrayList<>();
        for (KnowledgeNode node : view.getNodes()) {
            Map<String, Object> data = CollectionUtils.mapOf(
                "id", node.getId(),
                "label", node.getNodeKey(),
                "type", node.getType().getValue(),
                "version", node.getVersion(),
                "attributes", node.getAttributes());
            elements.add(CollectionUtils.mapOf("group", "nodes", "data", data));
        }
        for (KnowledgeEdge edge : view.getEdges()) {
            Map<String, Object> data = CollectionUtils.mapOf(
                "id", edge.getId(),
                "source", edge.getSourceId(),
                "target", edge.getTargetId(),
                "label", edge.getRelation(),
                "attributes", edge.getAttributes());
            elements.add(CollectionUtils.mapOf("group", "edges", "data", data));
        }
        return CollectionUtils.mapOf("elements", elements, "graphVersion", view.getGraphVersion());
    }

    public List<ProposalAudit> listAudits(String projectId) {
        return graphStore.listAudits(projectId);
    }

    private <T> T write(String projectId, Supplier<T> work) {
        T result = lockRegistry.withWriteLock(projectId, () -> transactionRunner.inTransaction(projectId, work));
        queryCache.invalidateProject(projectId);
        return result;
    }

    private void requireProject(String projectId) {
        if (StringUtils.isBlank(projectId)) {
            throw new ValidationException("projectId不能为空");
        }
    }
}
