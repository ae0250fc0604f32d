package com.novelforge.controller;

import com.novelforge.common.Result;
import com.novelforge.common.exception.MissingNodeException;
import com.novelforge.common.util.CollectionUtils;
import com.novelforge.domain.entity.KnowledgeEdge;
import com.novelforge.domain.entity.KnowledgeNode;
import com.novelforge.domain.entity.ProposalAudit;
import com.novelforge.dto.EdgeRequest;
import com.novelforge.dto.NodeUpsertRequest;
import com.novelforge.dto.SubgraphRequest;
import com.novelforge.model.GraphSnapshot;
import com.novelforge.model.NodeRef;
import com.novelforge.model.NodeType;
import com.novelforge.model.Subgraph;
import com.novelforge.service.graph.KnowledgeGraphService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 知识图谱管理接口
 */
@RestController
@RequestMapping("/graph")
@CrossOrigin(origins = "*")
public class KnowledgeGraphController {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeGraphController.class);

    @Autowired
    private KnowledgeGraphService graphService;

    @PutMapping("/{projectId}/nodes")
    public Result<KnowledgeNode> upsertNode(@PathVariable String projectId,
                                            @Valid @RequestBody NodeUpsertRequest request) {
        return Result.success(graphService.upsertNode(projectId, request.getType(), request.getKey(),
            request.getAttributes()));
    }

    @GetMapping("/{projectId}/nodes")
    public Result<List<KnowledgeNode>> listNodes(@PathVariable String projectId,
                                                 @RequestParam(required = false) String type) {
        return Result.success(graphService.listNodes(projectId, type != null ? NodeType.fromValue(type) : null));
    }

    @GetMapping("/{projectId}/nodes/{type}/{key}")
    public Result<KnowledgeNode> getNode(@PathVariable String projectId, @PathVariable String type,
                                         @PathVariable String key) {
        NodeRef ref = NodeRef.of(NodeType.fromValue(type), key);
        return Result.success(graphService.findNode(projectId, ref)
            .orElseThrow(() -> new MissingNodeException(ref.toString())));
    }

    @GetMapping("/{projectId}/nodes/{type}/{key}/relationships")
    public Result<List<KnowledgeEdge>> relationships(@PathVariable String projectId, @PathVariable String type,
                                                     @PathVariable String key) {
        return Result.success(graphService.relationships(projectId, NodeRef.of(NodeType.fromValue(type), key)));
    }

    @PostMapping("/{projectId}/edges")
    public Result<KnowledgeEdge> addEdge(@PathVariable String projectId, @Valid @RequestBody EdgeRequest request) {
        return Result.success(graphService.addEdge(projectId, NodeRef.parse(request.getSource()),
            NodeRef.parse(request.getTarget()), request.getRelation(), request.getAttributes()));
    }

    @PostMapping("/{projectId}/subgraph")
    public Result<Subgraph> subgraph(@PathVariable String projectId, @Valid @RequestBody SubgraphRequest request) {
        return Result.success(graphService.querySubgraph(projectId, request.getSeeds(), request.getDepth()));
    }

    // ==================== 快照 ====================

    @PostMapping("/{projectId}/snapshots")
    public Result<Map<String, Object>> snapshot(@PathVariable String projectId) {
        GraphSnapshot snapshot = graphService.snapshot(projectId);
        logger.info("📸 手动创建图谱快照: project={}, snapshot={}", projectId, snapshot.getId());
        return Result.success(describe(snapshot));
    }

    @GetMapping("/{projectId}/snapshots")
    public Result<List<Map<String, Object>>> listSnapshots(@PathVariable String projectId) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (GraphSnapshot snapshot : graphService.listSnapshots(projectId)) {
            result.add(describe(snapshot));
        }
        return Result.success(result);
    }

    @PostMapping("/{projectId}/snapshots/{snapshotId}/rollback")
    public Result<Map<String, Object>> rollback(@PathVariable String projectId, @PathVariable String snapshotId) {
        long version = graphService.rollback(projectId, snapshotId);
        return Result.success(CollectionUtils.mapOf("snapshotId", snapshotId, "graphVersion", version));
    }

    // ==================== 统计与导出 ====================

    @GetMapping("/{projectId}/stats")
    public Result<Map<String, Object>> stats(@PathVariable String projectId) {
        return Result.success(graphService.getGraphStatistics(projectId));
    }

    @GetMapping("/{projectId}/export")
    public Result<Map<String, Object>> export(@PathVariable String projectId) {
        return Result.success(graphService.exportCytoscape(projectId));
    }

    @GetMapping("/{projectId}/audits")
    public Result<List<ProposalAudit>> audits(@PathVariable String projectId) {
        return Result.success(graphService.listAudits(projectId));
    }

    private Map<String, Object> describe(GraphSnapshot snapshot) {
        return CollectionUtils.mapOf(
            "id", snapshot.getId(),
            "graphVersion", snapshot.getGraphVersion(),
            "nodeCount", snapshot.nodeCount(),
            "edgeCount", snapshot.edgeCount(),
            "createdAt", snapshot.getCreatedAt());
    }
}
