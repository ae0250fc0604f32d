package com.novelforge.common.exception;

/**
 * 建边时端点节点不存在
 */
public class MissingNodeException extends ReferenceException {

    private final String nodeRef;

    public MissingNodeException(String nodeRef) {
        super("图谱节点不存在: " + nodeRef, "MISSING_NODE");
        this.nodeRef = nodeRef;
    }

    public String getNodeRef() {
        return nodeRef;
    }
}
