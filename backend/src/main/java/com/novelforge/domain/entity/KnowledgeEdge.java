package com.novelforge.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 图谱关系边，两端节点必须在创建时存在
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@TableName(value = "knowledge_edges", autoResultMap = true)
public class KnowledgeEdge {

    @TableId(type = IdType.INPUT)
    private String id;

    private String projectId;

    private String sourceId;

    private String targetId;

    /**
     * 关系类型（PARTICIPATES_IN, LOCATED_AT, ALLY_OF ...）
     */
    private String relation;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> attributes;

    private LocalDateTime createdAt;

    public KnowledgeEdge copy() {
        return toBuilder()
            .attributes(attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>())
            .build();
    }
}
