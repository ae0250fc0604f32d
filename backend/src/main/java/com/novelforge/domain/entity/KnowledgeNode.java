package com.novelforge.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.novelforge.model.NodeRef;
import com.novelforge.model.NodeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 图谱节点（角色/地点/物品/规则/事件）
 *
 * (projectId, type, nodeKey) 在项目内唯一
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@TableName(value = "knowledge_nodes", autoResultMap = true)
public class KnowledgeNode {

    @TableId(type = IdType.INPUT)
    private String id;

    private String projectId;

    private NodeType type;

    /**
     * 业务键，如 lihang、magic_castle
     */
    private String nodeKey;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> attributes;

    /**
     * 节点版本，属性变化时递增
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public NodeRef ref() {
        return NodeRef.of(type, nodeKey);
    }

    public KnowledgeNode copy() {
        return toBuilder()
            .attributes(attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>())
            .build();
    }
}
