package com.novelforge.common.exception;

/**
 * 悬空引用：记忆条目元数据或边引用了不存在的图谱节点
 */
public class ReferenceException extends NovelMemoryException {

    public ReferenceException(String message) {
        super(message, "REFERENCE_ERROR");
    }

    protected ReferenceException(String message, String code) {
        super(message, code);
    }
}
