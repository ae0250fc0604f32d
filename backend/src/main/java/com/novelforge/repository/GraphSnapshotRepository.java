package com.novelforge.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.novelforge.domain.entity.GraphSnapshotRecord;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface GraphSnapshotRepository extends BaseMapper<GraphSnapshotRecord> {
}
