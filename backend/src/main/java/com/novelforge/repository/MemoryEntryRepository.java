package com.novelforge.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.novelforge.domain.entity.MemoryEntry;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 记忆条目 Mapper
 *
 * 查询走 LambdaQueryWrapper，保证 JSON 列经由 autoResultMap 反序列化
 */
@Mapper
public interface MemoryEntryRepository extends BaseMapper<MemoryEntry> {

    /**
     * 删除版本链上指定版本之后的版本（显式回滚）
     */
    @Delete("DELETE FROM memory_entries WHERE chain_id = #{chainId} AND version > #{version}")
    int deleteChainAfter(@Param("chainId") String chainId, @Param("version") int version);
}
