package com.novelforge.model;

/**
 * 记忆条目引用不存在节点时的处理策略
 */
public enum ReferencePolicy {
    /** 拒绝写入，抛出 ReferenceException */
    REJECT,
    /** 自动创建占位节点 */
    AUTO_CREATE
}
