package com.novelforge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一致性校验暂存的图谱变更，仅在请求被接受后原子提交
 *
 * 对同一节点的多次写入按顺序合并属性
 */
public class StagedGraphChanges {

    private final Map<NodeRef, StagedNodeUpsert> upserts = new LinkedHashMap<>();
    private final List<StagedEdge> edges = new ArrayList<>();

    public void stageNode(NodeRef ref, Map<String, Object> attributes, Integer baseVersion) {
        StagedNodeUpsert existing = upserts.get(ref);
        if (existing == null) {
            upserts.put(ref, new StagedNodeUpsert(ref, new LinkedHashMap<>(attributes), baseVersion));
        } else {
            existing.getAttributes().putAll(attributes);
        }
    }

    public void stageEdge(NodeRef source, NodeRef target, String relation, Map<String, Object> attributes) {
        for (StagedEdge edge : edges) {
            if (edge.getSource().equals(source) && edge.getTarget().equals(target)
                && edge.getRelation().equals(relation)) {
                edge.getAttributes().putAll(attributes);
                return;
            }
        }
        edges.add(new StagedEdge(source, target, relation, new LinkedHashMap<>(attributes)));
    }

    public boolean isStaged(NodeRef ref) {
        return upserts.containsKey(ref);
    }

    public Map<String, Object> stagedAttributes(NodeRef ref) {
        StagedNodeUpsert upsert = upserts.get(ref);
        return upsert != null ? Collections.unmodifiableMap(upsert.getAttributes()) : Collections.emptyMap();
    }

    public List<StagedNodeUpsert> getNodeUpserts() {
        return new ArrayList<>(upserts.values());
    }

    public List<StagedEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public boolean isEmpty() {
        return upserts.isEmpty() && edges.isEmpty();
    }
}
