package com.novelforge.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.novelforge.domain.entity.KnowledgeEdge;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface KnowledgeEdgeRepository extends BaseMapper<KnowledgeEdge> {

    @Delete("DELETE FROM knowledge_edges WHERE project_id = #{projectId}")
    int deleteByProjectId(@Param("projectId") String projectId);
}
