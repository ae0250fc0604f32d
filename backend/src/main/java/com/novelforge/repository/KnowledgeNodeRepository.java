package com.novelforge.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.novelforge.domain.entity.KnowledgeNode;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface KnowledgeNodeRepository extends BaseMapper<KnowledgeNode> {

    @Delete("DELETE FROM knowledge_nodes WHERE project_id = #{projectId}")
    int deleteByProjectId(@Param("projectId") String projectId);
}
