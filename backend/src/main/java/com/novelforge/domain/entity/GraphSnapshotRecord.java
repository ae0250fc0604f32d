package com.novelforge.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 图谱快照持久化记录，payload 为节点与边的完整 JSON 拷贝
 */
@Data
@TableName("graph_snapshots")
public class GraphSnapshotRecord {

    @TableId(type = IdType.INPUT)
    private String id;

    private String projectId;

    /**
     * 拍摄快照时的项目图谱版本
     */
    private Long graphVersion;

    private Integer nodeCount;

    private Integer edgeCount;

    private String payload;

    private LocalDateTime createdAt;
}
