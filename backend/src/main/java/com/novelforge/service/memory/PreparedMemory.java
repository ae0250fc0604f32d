package com.novelforge.service.memory;

import com.novelforge.model.MemoryKind;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * 已完成向量化、等待写入的记忆条目
 *
 * 向量化在写锁之外完成，写锁内只做校验和持久化
 */
@Getter
@AllArgsConstructor
public class PreparedMemory {

    private final String projectId;

    private final MemoryKind kind;

    private final String content;

    private final Map<String, Object> metadata;

    private final float[] embedding;
}
