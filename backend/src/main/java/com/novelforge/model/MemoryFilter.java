package com.novelforge.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * 记忆检索的元数据过滤条件
 */
@Data
@Builder
public class MemoryFilter {

    /**
     * 限定的记忆类型，为空表示不限
     */
    private Set<MemoryKind> kinds;

    /**
     * 创建时间下界（含）
     */
    private LocalDateTime createdFrom;

    /**
     * 创建时间上界（含）
     */
    private LocalDateTime createdTo;

    public static MemoryFilter none() {
        return MemoryFilter.builder().build();
    }

    public boolean matches(MemoryKind kind, LocalDateTime createdAt) {
        if (kinds != null && !kinds.isEmpty() && !kinds.contains(kind)) {
            return false;
        }
        if (createdFrom != null && createdAt != null && createdAt.isBefore(createdFrom)) {
            return false;
        }
        return createdTo == null || createdAt == null || !createdAt.isAfter(createdTo);
    }

    public String cacheKey() {
        return String.valueOf(kinds) + "|" + createdFrom + "|" + createdTo;
    }
}
