package com.novelforge.model;

import com.novelforge.domain.entity.KnowledgeEdge;
import com.novelforge.domain.entity.KnowledgeNode;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 从种子节点有界遍历得到的诱导子图
 */
@Data
@AllArgsConstructor
public class Subgraph {

    private List<KnowledgeNode> nodes;

    private List<KnowledgeEdge> edges;
}
