package com.novelforge.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.LocalDateTime;

/**
 * 项目级记忆状态：图谱版本计数器和固定的向量维度
 */
@TableName("project_memory_state")
public class ProjectMemoryState {

    @TableId(type = IdType.INPUT)
    private String projectId;

    /**
     * 图谱版本，每次提交图谱变更或回滚时递增
     */
    private Long graphVersion;

    /**
     * 向量维度，项目首次写入记忆时固定
     */
    private Integer embeddingDimension;

    private LocalDateTime updatedAt;

    public ProjectMemoryState() {}

    public ProjectMemoryState(String projectId) {
        this.projectId = projectId;
        this.graphVersion = 0L;
        this.updatedAt = LocalDateTime.now();
    }

    public ProjectMemoryState copy() {
        ProjectMemoryState copy = new ProjectMemoryState();
        copy.projectId = projectId;
        copy.graphVersion = graphVersion;
        copy.embeddingDimension = embeddingDimension;
        copy.updatedAt = updatedAt;
        return copy;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public Long getGraphVersion() {
        return graphVersion;
    }

    public void setGraphVersion(Long graphVersion) {
        this.graphVersion = graphVersion;
    }

    public Integer getEmbeddingDimension() {
        return embeddingDimension;
    }

    public void setEmbeddingDimension(Integer embeddingDimension) {
        this.embeddingDimension = embeddingDimension;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
