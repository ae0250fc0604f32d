package com.novelforge.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.novelforge.domain.entity.ProposalAudit;
import org.apache.ibatis.annotations.Mapper;

/**
 * 并发提案审计 Mapper
 */
@Mapper
public interface ProposalAuditRepository extends BaseMapper<ProposalAudit> {
}
