package com.novelforge.model;

import com.novelforge.domain.entity.KnowledgeEdge;
import com.novelforge.domain.entity.KnowledgeNode;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 项目图谱在某一时刻的不可变完整拷贝
 *
 * 持久化快照用于回滚与审计；未持久化的读视图（id 为空）用于请求级快照隔离
 */
public final class GraphSnapshot {

    private final String id;
    private final String projectId;
    private final long graphVersion;
    private final List<KnowledgeNode> nodes;
    private final List<KnowledgeEdge> edges;
    private final LocalDateTime createdAt;

    private final Map<NodeRef, KnowledgeNode> byRef = new HashMap<>();
    private final Map<String, KnowledgeNode> byId = new HashMap<>();

    public GraphSnapshot(String id, String projectId, long graphVersion,
                         List<KnowledgeNode> nodes, List<KnowledgeEdge> edges, LocalDateTime createdAt) {
        this.id = id;
        this.projectId = projectId;
        this.graphVersion = graphVersion;
        List<KnowledgeNode> nodeCopies = new ArrayList<>();
        for (KnowledgeNode node : nodes) {
            KnowledgeNode copy = node.copy();
            nodeCopies.add(copy);
            byRef.put(copy.ref(), copy);
            byId.put(copy.getId(), copy);
        }
        this.nodes = Collections.unmodifiableList(nodeCopies);
        this.edges = Collections.unmodifiableList(
            edges.stream().map(KnowledgeEdge::copy).collect(Collectors.toList()));
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getProjectId() {
        return projectId;
    }

    public long getGraphVersion() {
        return graphVersion;
    }

    /**
     * 返回拷贝，快照本身不会被调用方修改
     */
    public List<KnowledgeNode> getNodes() {
        return nodes.stream().map(KnowledgeNode::copy).collect(Collectors.toList());
    }

    public List<KnowledgeEdge> getEdges() {
        return edges.stream().map(KnowledgeEdge::copy).collect(Collectors.toList());
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public Optional<KnowledgeNode> findNode(NodeRef ref) {
        KnowledgeNode node = byRef.get(ref);
        return node != null ? Optional.of(node.copy()) : Optional.empty();
    }

    public Optional<KnowledgeNode> findNodeById(String nodeId) {
        KnowledgeNode node = byId.get(nodeId);
        return node != null ? Optional.of(node.copy()) : Optional.empty();
    }

    public List<KnowledgeNode> nodesOfType(NodeType type) {
        return nodes.stream()
            .filter(n -> n.getType() == type)
            .map(KnowledgeNode::copy)
            .collect(Collectors.toList());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }
}
