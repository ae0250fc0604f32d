package com.novelforge.persistence.memory;

import com.novelforge.common.util.VectorUtils;
import com.novelforge.domain.entity.KnowledgeEdge;
import com.novelforge.domain.entity.KnowledgeNode;
import com.novelforge.domain.entity.MemoryEntry;
import com.novelforge.domain.entity.ProjectMemoryState;
import com.novelforge.domain.entity.ProposalAudit;
import com.novelforge.model.GraphSnapshot;
import com.novelforge.model.MemoryFilter;
import com.novelforge.model.NodeType;
import com.novelforge.model.ScoredMemory;
import com.novelforge.persistence.GraphStore;
import com.novelforge.persistence.MemoryEntryStore;
import com.novelforge.persistence.ProjectStateStore;
import com.novelforge.persistence.TransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 内存存储（开发/测试用，重启后数据丢失）
 *
 * 每个项目一组表，写事务在私有副本上进行，成功后整体替换已发布版本；
 * 读操作只看已发布版本（或当前线程自己的事务副本），不会阻塞
 */
@Component
@ConditionalOnProperty(name = "novel.memory.persistence", havingValue = "memory")
public class InMemoryNarrativeStore implements MemoryEntryStore, GraphStore, ProjectStateStore, TransactionRunner {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryNarrativeStore.class);

    private final Map<String, ProjectTables> published = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> writeLocks = new ConcurrentHashMap<>();
    private final ThreadLocal<Map<String, ProjectTables>> working = ThreadLocal.withInitial(HashMap::new);

    // 条目ID/版本链ID → 项目ID
    private final Map<String, String> entryProjects = new ConcurrentHashMap<>();
    private final Map<String, String> chainProjects = new ConcurrentHashMap<>();

    public InMemoryNarrativeStore() {
        logger.warn("⚠️ 正在使用内存存储，记忆与图谱数据仅保存在内存中，重启后将全部丢失！");
        logger.warn("   修改配置: application.yml -> novel.memory.persistence: jdbc");
    }

    // ==================== 事务 ====================

    @Override
    public <T> T inTransaction(String projectId, Supplier<T> work) {
        Map<String, ProjectTables> tx = working.get();
        if (tx.containsKey(projectId)) {
            return work.get();
        }
        ReentrantLock lock = writeLocks.computeIfAbsent(projectId, k -> new ReentrantLock());
        lock.lock();
        try {
            ProjectTables copy = published.getOrDefault(projectId, new ProjectTables()).copy();
            tx.put(projectId, copy);
            T result;
            try {
                result = work.get();
            } finally {
                tx.remove(projectId);
            }
            published.put(projectId, copy);
            return result;
        } finally {
            lock.unlock();
            if (tx.isEmpty()) {
                working.remove();
            }
        }
    }

    private ProjectTables view(String projectId) {
        ProjectTables tables = working.get().get(projectId);
        if (tables != null) {
            return tables;
        }
        return published.getOrDefault(projectId, ProjectTables.EMPTY);
    }

    private void mutate(String projectId, Consumer<ProjectTables> change) {
        inTransaction(projectId, () -> {
            change.accept(working.get().get(projectId));
            return null;
        });
    }

    // ==================== 记忆条目 ====================

    @Override
    public void insert(MemoryEntry entry) {
        MemoryEntry stored = entry.copy();
        mutate(entry.getProjectId(), t -> t.entries.put(stored.getId(), stored));
        entryProjects.put(stored.getId(), stored.getProjectId());
        chainProjects.put(stored.getChainId(), stored.getProjectId());
    }

    @Override
    public Optional<MemoryEntry> findById(String entryId) {
        String projectId = entryProjects.get(entryId);
        if (projectId == null) {
            return Optional.empty();
        }
        MemoryEntry entry = view(projectId).entries.get(entryId);
        return entry != null ? Optional.of(entry.copy()) : Optional.empty();
    }

    @Override
    public List<MemoryEntry> findChain(String chainId) {
        String projectId = chainProjects.get(chainId);
        if (projectId == null) {
            return Collections.emptyList();
        }
        return view(projectId).entries.values().stream()
            .filter(e -> chainId.equals(e.getChainId()))
            .sorted(Comparator.comparing(MemoryEntry::getVersion))
            .map(MemoryEntry::copy)
            .collect(Collectors.toList());
    }

    @Override
    public List<MemoryEntry> findLatest(String projectId, MemoryFilter filter, int limit) {
        return latestEntries(view(projectId), filter).stream()
            .limit(limit)
            .map(MemoryEntry::copy)
            .collect(Collectors.toList());
    }

    @Override
    public List<ScoredMemory> nearest(String projectId, float[] vector, MemoryFilter filter, int candidateLimit) {
        List<ScoredMemory> scored = new ArrayList<>();
        for (MemoryEntry entry : latestEntries(view(projectId), filter)) {
            if (entry.getEmbedding() == null) {
                continue;
            }
            scored.add(new ScoredMemory(entry.copy(), VectorUtils.cosine(vector, entry.getEmbedding())));
        }
        scored.sort(Comparator.comparingDouble(ScoredMemory::getSimilarity).reversed());
        return scored.size() > candidateLimit ? new ArrayList<>(scored.subList(0, candidateLimit)) : scored;
    }

    @Override
    public int deleteChainAfter(String chainId, int version) {
        String projectId = chainProjects.get(chainId);
        if (projectId == null) {
            return 0;
        }
        int[] removed = {0};
        mutate(projectId, t -> {
            List<String> ids = t.entries.values().stream()
                .filter(e -> chainId.equals(e.getChainId()) && e.getVersion() > version)
                .map(MemoryEntry::getId)
                .collect(Collectors.toList());
            ids.forEach(t.entries::remove);
            removed[0] = ids.size();
        });
        return removed[0];
    }

    /**
     * 没有后继版本的条目，按创建时间倒序（同一时刻后写入者在前）
     */
    private List<MemoryEntry> latestEntries(ProjectTables tables, MemoryFilter filter) {
        Set<String> superseded = new HashSet<>();
        for (MemoryEntry entry : tables.entries.values()) {
            if (entry.getPreviousVersionId() != null) {
                superseded.add(entry.getPreviousVersionId());
            }
        }
        List<MemoryEntry> latest = new ArrayList<>();
        for (MemoryEntry entry : tables.entries.values()) {
            if (!superseded.contains(entry.getId()) && filter.matches(entry.getKind(), entry.getCreatedAt())) {
                latest.add(entry);
            }
        }
        Collections.reverse(latest);
        latest.sort(Comparator.comparing(MemoryEntry::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return latest;
    }

    // ==================== 图谱 ====================

    @Override
    public Optional<KnowledgeNode> findNode(String projectId, NodeType type, String nodeKey) {
        return view(projectId).nodes.values().stream()
            .filter(n -> n.getType() == type && n.getNodeKey().equals(nodeKey))
            .findFirst()
            .map(KnowledgeNode::copy);
    }

    @Override
    public Optional<KnowledgeNode> findNodeById(String projectId, String nodeId) {
        KnowledgeNode node = view(projectId).nodes.get(nodeId);
        return node != null ? Optional.of(node.copy()) : Optional.empty();
    }

    @Override
    public List<KnowledgeNode> listNodes(String projectId, NodeType type) {
        return view(projectId).nodes.values().stream()
            .filter(n -> type == null || n.getType() == type)
            .map(KnowledgeNode::copy)
            .collect(Collectors.toList());
    }

    @Override
    public void insertNode(KnowledgeNode node) {
        KnowledgeNode stored = node.copy();
        mutate(node.getProjectId(), t -> t.nodes.put(stored.getId(), stored));
    }

    @Override
    public void updateNode(KnowledgeNode node) {
        insertNode(node);
    }

    @Override
    public Optional<KnowledgeEdge> findEdge(String projectId, String sourceId, String targetId, String relation) {
        return view(projectId).edges.values().stream()
            .filter(e -> e.getSourceId().equals(sourceId) && e.getTargetId().equals(targetId)
                && e.getRelation().equals(relation))
            .findFirst()
            .map(KnowledgeEdge::copy);
    }

    @Override
    public void insertEdge(KnowledgeEdge edge) {
        KnowledgeEdge stored = edge.copy();
        mutate(edge.getProjectId(), t -> t.edges.put(stored.getId(), stored));
    }

    @Override
    public void updateEdge(KnowledgeEdge edge) {
        insertEdge(edge);
    }

    @Override
    public List<KnowledgeEdge> listEdges(String projectId) {
        return view(projectId).edges.values().stream()
            .map(KnowledgeEdge::copy)
            .collect(Collectors.toList());
    }

    @Override
    public List<KnowledgeEdge> edgesTouching(String projectId, Collection<String> nodeIds) {
        Set<String> ids = new HashSet<>(nodeIds);
        return view(projectId).edges.values().stream()
            .filter(e -> ids.contains(e.getSourceId()) || ids.contains(e.getTargetId()))
            .map(KnowledgeEdge::copy)
            .collect(Collectors.toList());
    }

    @Override
    public void replaceGraph(String projectId, List<KnowledgeNode> nodes, List<KnowledgeEdge> edges) {
        mutate(projectId, t -> {
            t.nodes.clear();
            t.edges.clear();
            nodes.forEach(n -> t.nodes.put(n.getId(), n.copy()));
            edges.forEach(e -> t.edges.put(e.getId(), e.copy()));
        });
    }

    @Override
    public GraphSnapshot readView(String projectId) {
        ProjectTables tables = view(projectId);
        long version = tables.state != null && tables.state.getGraphVersion() != null
            ? tables.state.getGraphVersion() : 0L;
        return new GraphSnapshot(null, projectId, version,
            new ArrayList<>(tables.nodes.values()), new ArrayList<>(tables.edges.values()), LocalDateTime.now());
    }

    @Override
    public void saveSnapshot(GraphSnapshot snapshot) {
        mutate(snapshot.getProjectId(), t -> t.snapshots.put(snapshot.getId(), snapshot));
    }

    @Override
    public Optional<GraphSnapshot> findSnapshot(String projectId, String snapshotId) {
        return Optional.ofNullable(view(projectId).snapshots.get(snapshotId));
    }

    @Override
    public List<GraphSnapshot> listSnapshots(String projectId) {
        return new ArrayList<>(view(projectId).snapshots.values());
    }

    @Override
    public void insertAudit(ProposalAudit audit) {
        mutate(audit.getProjectId(), t -> t.audits.add(audit));
    }

    @Override
    public List<ProposalAudit> listAudits(String projectId) {
        return new ArrayList<>(view(projectId).audits);
    }

    // ==================== 项目状态 ====================

    @Override
    public ProjectMemoryState load(String projectId) {
        ProjectMemoryState state = view(projectId).state;
        return state != null ? state.copy() : new ProjectMemoryState(projectId);
    }

    @Override
    public void save(ProjectMemoryState state) {
        ProjectMemoryState stored = state.copy();
        mutate(state.getProjectId(), t -> t.state = stored);
    }

    /**
     * 单个项目的全部表；存入的对象不可原地修改，因此复制时只需复制容器
     */
    private static final class ProjectTables {

        static final ProjectTables EMPTY = new ProjectTables();

        final Map<String, MemoryEntry> entries = new LinkedHashMap<>();
        final Map<String, KnowledgeNode> nodes = new LinkedHashMap<>();
        final Map<String, KnowledgeEdge> edges = new LinkedHashMap<>();
        final Map<String, GraphSnapshot> snapshots = new LinkedHashMap<>();
        final List<ProposalAudit> audits = new ArrayList<>();
        ProjectMemoryState state;

        ProjectTables copy() {
            ProjectTables copy = new ProjectTables();
            copy.entries.putAll(entries);
            copy.nodes.putAll(nodes);
            copy.edges.putAll(edges);
            copy.snapshots.putAll(snapshots);
            copy.audits.addAll(audits);
            copy.state = state;
            return copy;
        }
    }
}
