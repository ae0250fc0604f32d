package com.novelforge.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.novelforge.model.MemoryKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 记忆条目实体
 *
 * 写入后不可修改，只能通过追加新版本演进；版本链通过 previousVersionId 串联，
 * chainId 为链上第一个版本的ID
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@TableName(value = "memory_entries", autoResultMap = true)
public class MemoryEntry {

    @TableId(type = IdType.INPUT)
    private String id;

    /**
     * 项目ID
     */
    private String projectId;

    /**
     * 记忆类型（summary/event/character_state/plot_point/worldbuilding）
     */
    private MemoryKind kind;

    /**
     * 记忆内容
     */
    private String content;

    /**
     * 元数据（不透明键值，nodeRefs/nodeIds 用于图谱交叉引用）
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> metadata;

    /**
     * 向量（维度按项目固定）
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private float[] embedding;

    /**
     * 版本号，从1开始严格递增
     */
    private Integer version;

    /**
     * 版本链ID（首个版本的ID）
     */
    private String chainId;

    /**
     * 上一个版本ID，首个版本为空
     */
    private String previousVersionId;

    private LocalDateTime createdAt;

    /**
     * 防御性复制，避免调用方修改存储中的对象
     */
    public MemoryEntry copy() {
        return toBuilder()
            .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
            .embedding(embedding != null ? embedding.clone() : null)
            .build();
    }
}
