package com.novelforge.persistence.jdbc;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.common.exception.ProjectCorruptedException;
import com.novelforge.common.exception.StorageException;
import com.novelforge.domain.entity.GraphSnapshotRecord;
import com.novelforge.domain.entity.KnowledgeEdge;
import com.novelforge.domain.entity.KnowledgeNode;
import com.novelforge.domain.entity.ProjectMemoryState;
import com.novelforge.domain.entity.ProposalAudit;
import com.novelforge.model.GraphSnapshot;
import com.novelforge.model.NodeType;
import com.novelforge.persistence.GraphStore;
import com.novelforge.repository.GraphSnapshotRepository;
import com.novelforge.repository.KnowledgeEdgeRepository;
import com.novelforge.repository.KnowledgeNodeRepository;
import com.novelforge.repository.ProjectMemoryStateRepository;
import com.novelforge.repository.ProposalAuditRepository;
import lombok.Data;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 基于 MyBatis-Plus 的图谱存储，快照以 JSON 形式整体保存
 */
@Component
@ConditionalOnProperty(name = "novel.memory.persistence", havingValue = "jdbc", matchIfMissing = true)
public class MyBatisGraphStore extends MyBatisStoreSupport implements GraphStore {

    private final KnowledgeNodeRepository nodeRepository;
    private final KnowledgeEdgeRepository edgeRepository;
    private final GraphSnapshotRepository snapshotRepository;
    private final ProposalAuditRepository auditRepository;
    private final ProjectMemoryStateRepository stateRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate readTemplate;

    public MyBatisGraphStore(KnowledgeNodeRepository nodeRepository,
                             KnowledgeEdgeRepository edgeRepository,
                             GraphSnapshotRepository snapshotRepository,
                             ProposalAuditRepository auditRepository,
                             ProjectMemoryStateRepository stateRepository,
                             ObjectMapper objectMapper,
                             PlatformTransactionManager transactionManager) {
        this.nodeRepository = nodeRepository;
        this.edgeRepository = edgeRepository;
        this.snapshotRepository = snapshotRepository;
        this.auditRepository = auditRepository;
        this.stateRepository = stateRepository;
        this.objectMapper = objectMapper;
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.readTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
    }

    @Override
    public Optional<KnowledgeNode> findNode(String projectId, NodeType type, String nodeKey) {
        return execute("查询节点", () -> Optional.ofNullable(nodeRepository.selectOne(
            new LambdaQueryWrapper<KnowledgeNode>()
                .eq(KnowledgeNode::getProjectId, projectId)
                .eq(KnowledgeNode::getType, type)
                .eq(KnowledgeNode::getNodeKey, nodeKey))));
    }

    @Override
    public Optional<KnowledgeNode> findNodeById(String projectId, String nodeId) {
        return execute("查询节点", () -> Optional.ofNullable(nodeRepository.selectById(nodeId))
            .filter(n -> projectId.equals(n.getProjectId())));
    }

    @Override
    public List<KnowledgeNode> listNodes(String projectId, NodeType type) {
        LambdaQueryWrapper<KnowledgeNode> wrapper = new LambdaQueryWrapper<KnowledgeNode>()
            .eq(KnowledgeNode::getProjectId, projectId)
            .eq(type != null, KnowledgeNode::getType, type)
            .orderByAsc(KnowledgeNode::getCreatedAt);
        return execute("列出节点", () -> nodeRepository.selectList(wrapper));
    }

    @Override
    public void insertNode(KnowledgeNode node) {
        run("写入节点", () -> nodeRepository.insert(node));
    }

    @Override
    public void updateNode(KnowledgeNode node) {
        run("更新节点", () -> nodeRepository.updateById(node));
    }

    @Override
    public Optional<KnowledgeEdge> findEdge(String projectId, String sourceId, String targetId, String relation) {
        return execute("查询关系", () -> Optional.ofNullable(edgeRepository.selectOne(
            new LambdaQueryWrapper<KnowledgeEdge>()
                .eq(KnowledgeEdge::getProjectId, projectId)
                .eq(KnowledgeEdge::getSourceId, sourceId)
                .eq(KnowledgeEdge::getTargetId, targetId)
                .eq(KnowledgeEdge::getRelation, relation))));
    }

    @Override
    public void insertEdge(KnowledgeEdge edge) {
        run("写入关系", () -> edgeRepository.insert(edge));
    }

    @Override
    public void updateEdge(KnowledgeEdge edge) {
        run("更新关系", () -> edgeRepository.updateById(edge));
    }

    @Override
    public List<KnowledgeEdge> listEdges(String projectId) {
        return execute("列出关系", () -> edgeRepository.selectList(
            new LambdaQueryWrapper<KnowledgeEdge>()
                .eq(KnowledgeEdge::getProjectId, projectId)
                .orderByAsc(KnowledgeEdge::getCreatedAt)));
    }

    @Override
    public List<KnowledgeEdge> edgesTouching(String projectId, Collection<String> nodeIds) {
        if (nodeIds.isEmpty()) {
            return Collections.emptyList();
        }
        return execute("查询关联关系", () -> edgeRepository.selectList(
            new LambdaQueryWrapper<KnowledgeEdge>()
                .eq(KnowledgeEdge::getProjectId, projectId)
                .and(w -> w.in(KnowledgeEdge::getSourceId, nodeIds)
                    .or()
                    .in(KnowledgeEdge::getTargetId, nodeIds))));
    }

    @Override
    public void replaceGraph(String projectId, List<KnowledgeNode> nodes, List<KnowledgeEdge> edges) {
        run("替换图谱", () -> {
            edgeRepository.deleteByProjectId(projectId);
            nodeRepository.deleteByProjectId(projectId);
            nodes.forEach(nodeRepository::insert);
            edges.forEach(edgeRepository::insert);
        });
    }

    @Override
    public GraphSnapshot readView(String projectId) {
        return execute("读取图谱视图", () -> readTemplate.execute(status -> {
            ProjectMemoryState state = stateRepository.selectById(projectId);
            long version = state != null && state.getGraphVersion() != null ? state.getGraphVersion() : 0L;
            return new GraphSnapshot(null, projectId, version,
                listNodes(projectId, null), listEdges(projectId), LocalDateTime.now());
        }));
    }

    @Override
    public void saveSnapshot(GraphSnapshot snapshot) {
        GraphSnapshotRecord record = new GraphSnapshotRecord();
        record.setId(snapshot.getId());
        record.setProjectId(snapshot.getProjectId());
        record.setGraphVersion(snapshot.getGraphVersion());
        record.setNodeCount(snapshot.nodeCount());
        record.setEdgeCount(snapshot.edgeCount());
        record.setCreatedAt(snapshot.getCreatedAt());
        SnapshotPayload payload = new SnapshotPayload();
        payload.setNodes(snapshot.getNodes());
        payload.setEdges(snapshot.getEdges());
        try {
            record.setPayload(objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new StorageException("快照序列化失败: " + e.getMessage(), e, false);
        }
        run("保存快照", () -> snapshotRepository.insert(record));
    }

    @Override
    public Optional<GraphSnapshot> findSnapshot(String projectId, String snapshotId) {
        GraphSnapshotRecord record = execute("读取快照", () -> snapshotRepository.selectById(snapshotId));
        if (record == null || !projectId.equals(record.getProjectId())) {
            return Optional.empty();
        }
        return Optional.of(toSnapshot(record));
    }

    @Override
    public List<GraphSnapshot> listSnapshots(String projectId) {
        List<GraphSnapshotRecord> records = execute("列出快照", () -> snapshotRepository.selectList(
            new LambdaQueryWrapper<GraphSnapshotRecord>()
                .eq(GraphSnapshotRecord::getProjectId, projectId)
                .orderByAsc(GraphSnapshotRecord::getCreatedAt)));
        return records.stream().map(this::toSnapshot).collect(Collectors.toList());
    }

    @Override
    public void insertAudit(ProposalAudit audit) {
        run("写入提案审计", () -> auditRepository.insert(audit));
    }

    @Override
    public List<ProposalAudit> listAudits(String projectId) {
        return execute("查询提案审计", () -> auditRepository.selectList(
            new LambdaQueryWrapper<ProposalAudit>()
                .eq(ProposalAudit::getProjectId, projectId)
                .orderByAsc(ProposalAudit::getCreatedAt)));
    }

    private GraphSnapshot toSnapshot(GraphSnapshotRecord record) {
        try {
            SnapshotPayload payload = objectMapper.readValue(record.getPayload(), SnapshotPayload.class);
            return new GraphSnapshot(record.getId(), record.getProjectId(), record.getGraphVersion(),
                payload.getNodes(), payload.getEdges(), record.getCreatedAt());
        } catch (JsonProcessingException e) {
            throw new ProjectCorruptedException(record.getProjectId(), "快照 " + record.getId() + " 无法解析", e);
        }
    }

    @Data
    static class SnapshotPayload {
        private List<KnowledgeNode> nodes = new ArrayList<>();
        private List<KnowledgeEdge> edges = new ArrayList<>();
    }
}
