package com.novelforge.service.context;

import com.novelforge.domain.entity.KnowledgeEdge;
import com.novelforge.domain.entity.KnowledgeNode;
import com.novelforge.model.Subgraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把子图格式化为提示词可用的事实行，每个节点/关系一行
 */
public final class GraphFactFormatter {

    private GraphFactFormatter() {
    }

    public static List<String> format(Subgraph subgraph) {
        List<String> lines = new ArrayList<>();
        if (subgraph == null) {
            return lines;
        }
        Map<String, String> refById = new HashMap<>();
        for (KnowledgeNode node : subgraph.getNodes()) {
            refById.put(node.getId(), node.ref().toString());
            lines.add(formatNode(node));
        }
        for (KnowledgeEdge edge : subgraph.getEdges()) {
            String source = refById.getOrDefault(edge.getSourceId(), edge.getSourceId());
            String target = refById.getOrDefault(edge.getTargetId(), edge.getTargetId());
            StringBuilder line = new StringBuilder()
                .append("- ").append(source).append(" -[").append(edge.getRelation()).append("]-> ").append(target);
            if (edge.getAttributes() != null && !edge.getAttributes().isEmpty()) {
                line.append(" ").append(formatAttributes(edge.getAttributes()));
            }
            lines.add(line.toString());
        }
        return lines;
    }

    public static String formatNode(KnowledgeNode node) {
        StringBuilder line = new StringBuilder("- ").append(node.ref());
        if (node.getAttributes() != null && !node.getAttributes().isEmpty()) {
            line.append(" ").append(formatAttributes(node.getAttributes()));
        }
        return line.toString();
    }

    private static String formatAttributes(Map<String, Object> attributes) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        return sb.append("}").toString();
    }
}
