package com.novelforge.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

/**
 * 待提交的关系边，端点以节点引用表示，提交时解析为节点ID
 */
@Data
@AllArgsConstructor
public class StagedEdge {

    private NodeRef source;

    private NodeRef target;

    private String relation;

    private Map<String, Object> attributes;
}
