package com.novelforge.persistence;

import com.novelforge.domain.entity.MemoryEntry;
import com.novelforge.model.MemoryFilter;
import com.novelforge.model.ScoredMemory;

import java.util.List;
import java.util.Optional;

/**
 * 记忆条目持久化接口（创建/读取/追加版本 + 最近邻检索）
 *
 * 具体引擎可替换，核心逻辑只依赖此接口
 */
public interface MemoryEntryStore {

    void insert(MemoryEntry entry);

    Optional<MemoryEntry> findById(String entryId);

    /**
     * 版本链上的全部版本，按版本号升序
     */
    List<MemoryEntry> findChain(String chainId);

    /**
     * 项目内各版本链的最新版本，按创建时间倒序
     */
    List<MemoryEntry> findLatest(String projectId, MemoryFilter filter, int limit);

    /**
     * 在最新版本中按余弦相似度做最近邻检索
     *
     * @param candidateLimit 返回的候选数量上限（调用方会再做并列排序）
     */
    List<ScoredMemory> nearest(String projectId, float[] vector, MemoryFilter filter, int candidateLimit);

    /**
     * 物理删除版本链上 version 之后的版本，仅用于显式回滚
     *
     * @return 删除条数
     */
    int deleteChainAfter(String chainId, int version);
}
