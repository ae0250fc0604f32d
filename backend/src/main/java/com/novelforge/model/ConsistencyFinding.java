package com.novelforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * 一致性校验发现
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsistencyFinding {

    /**
     * 触发内容引用（requestId#attempt 或事实描述）
     */
    private String contentRef;

    private FindingKind kind;

    private Severity severity;

    /**
     * 面向作者的描述
     */
    private String description;

    /**
     * 冲突事实引用（节点 type:key 或事件引用）
     */
    private Set<String> conflictingRefs;

    public boolean isBlocking() {
        return severity == Severity.BLOCKING;
    }
}
