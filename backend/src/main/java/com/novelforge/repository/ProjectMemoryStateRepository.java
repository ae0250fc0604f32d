package com.novelforge.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.novelforge.domain.entity.ProjectMemoryState;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface ProjectMemoryStateRepository extends BaseMapper<ProjectMemoryState> {
}
