package com.novelforge.persistence;

import com.novelforge.domain.entity.ProjectMemoryState;

/**
 * 项目级状态（图谱版本计数器、向量维度）
 */
public interface ProjectStateStore {

    /**
     * 读取项目状态，不存在时返回初始状态（版本0，维度未定）
     */
    ProjectMemoryState load(String projectId);

    void save(ProjectMemoryState state);
}
