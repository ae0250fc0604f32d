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
import java.util.Map;

/**
 * 并发提案审计：后提交的请求覆盖了并发提交的不同属性值时，记录被覆盖的提案
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName(value = "proposal_audit", autoResultMap = true)
public class ProposalAudit {

    @TableId(type = IdType.INPUT)
    private String id;

    private String projectId;

    /**
     * 胜出（最后提交）的请求ID
     */
    private String winningRequestId;

    /**
     * 节点引用 type:key
     */
    private String nodeRef;

    /**
     * 请求开始时快照中的节点版本
     */
    private Integer baseVersion;

    /**
     * 提交时已存在的节点版本
     */
    private Integer committedVersion;

    /**
     * 被覆盖的属性值（来自并发提交的提案）
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> overwrittenValues;

    /**
     * 胜出的属性值
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> appliedValues;

    private LocalDateTime createdAt;
}
