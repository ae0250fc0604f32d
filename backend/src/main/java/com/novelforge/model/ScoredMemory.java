package com.novelforge.model;

import com.novelforge.domain.entity.MemoryEntry;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 带相似度的检索结果
 */
@Data
@AllArgsConstructor
public class ScoredMemory {

    private MemoryEntry entry;

    /**
     * 余弦相似度，[-1, 1]
     */
    private double similarity;
}
