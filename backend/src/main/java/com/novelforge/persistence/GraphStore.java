package com.novelforge.persistence;

import com.novelforge.domain.entity.KnowledgeEdge;
import com.novelforge.domain.entity.KnowledgeNode;
import com.novelforge.domain.entity.ProposalAudit;
import com.novelforge.model.GraphSnapshot;
import com.novelforge.model.NodeType;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 图谱节点/边/快照持久化接口
 */
public interface GraphStore {

    Optional<KnowledgeNode> findNode(String projectId, NodeType type, String nodeKey);

    Optional<KnowledgeNode> findNodeById(String projectId, String nodeId);

    /**
     * @param type 为 null 时返回全部类型
     */
    List<KnowledgeNode> listNodes(String projectId, NodeType type);

    void insertNode(KnowledgeNode node);

    void updateNode(KnowledgeNode node);

    Optional<KnowledgeEdge> findEdge(String projectId, String sourceId, String targetId, String relation);

    void insertEdge(KnowledgeEdge edge);

    void updateEdge(KnowledgeEdge edge);

    List<KnowledgeEdge> listEdges(String projectId);

    /**
     * 任一端点在 nodeIds 中的边
     */
    List<KnowledgeEdge> edgesTouching(String projectId, Collection<String> nodeIds);

    /**
     * 用给定的节点与边整体替换项目图谱（回滚）
     */
    void replaceGraph(String projectId, List<KnowledgeNode> nodes, List<KnowledgeEdge> edges);

    /**
     * 当前图谱的一致读视图（未持久化，id 为空），节点、边与图谱版本来自同一时刻
     */
    GraphSnapshot readView(String projectId);

    void saveSnapshot(GraphSnapshot snapshot);

    Optional<GraphSnapshot> findSnapshot(String projectId, String snapshotId);

    List<GraphSnapshot> listSnapshots(String projectId);

    void insertAudit(ProposalAudit audit);

    List<ProposalAudit> listAudits(String projectId);
}
