package com.novelforge.persistence.jdbc;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.novelforge.common.util.VectorUtils;
import com.novelforge.domain.entity.MemoryEntry;
import com.novelforge.model.MemoryFilter;
import com.novelforge.model.ScoredMemory;
import com.novelforge.persistence.MemoryEntryStore;
import com.novelforge.repository.MemoryEntryRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 基于 MyBatis-Plus 的记忆条目存储
 *
 * 最近邻检索：SQL 过滤出最新版本，相似度在内存中计算
 */
@Component
@ConditionalOnProperty(name = "novel.memory.persistence", havingValue = "jdbc", matchIfMissing = true)
public class MyBatisMemoryEntryStore extends MyBatisStoreSupport implements MemoryEntryStore {

    private static final String LATEST_VERSION_ONLY =
        "SELECT 1 FROM memory_entries nv WHERE nv.previous_version_id = memory_entries.id";

    private final MemoryEntryRepository memoryEntryRepository;

    public MyBatisMemoryEntryStore(MemoryEntryRepository memoryEntryRepository) {
        this.memoryEntryRepository = memoryEntryRepository;
    }

    @Override
    public void insert(MemoryEntry entry) {
        run("写入记忆条目", () -> memoryEntryRepository.insert(entry));
    }

    @Override
    public Optional<MemoryEntry> findById(String entryId) {
        return execute("读取记忆条目", () -> Optional.ofNullable(memoryEntryRepository.selectById(entryId)));
    }

    @Override
    public List<MemoryEntry> findChain(String chainId) {
        return execute("读取版本链", () -> memoryEntryRepository.selectList(
            new LambdaQueryWrapper<MemoryEntry>()
                .eq(MemoryEntry::getChainId, chainId)
                .orderByAsc(MemoryEntry::getVersion)));
    }

    @Override
    public List<MemoryEntry> findLatest(String projectId, MemoryFilter filter, int limit) {
        LambdaQueryWrapper<MemoryEntry> wrapper = latestWrapper(projectId, filter)
            .orderByDesc(MemoryEntry::getCreatedAt)
            .last("LIMIT " + Math.max(0, limit));
        return execute("查询最新记忆", () -> memoryEntryRepository.selectList(wrapper));
    }

    @Override
    public List<ScoredMemory> nearest(String projectId, float[] vector, MemoryFilter filter, int candidateLimit) {
        LambdaQueryWrapper<MemoryEntry> wrapper = latestWrapper(projectId, filter)
            .isNotNull(MemoryEntry::getEmbedding)
            .orderByDesc(MemoryEntry::getCreatedAt);
        List<MemoryEntry> candidates = execute("检索记忆", () -> memoryEntryRepository.selectList(wrapper));

        List<ScoredMemory> scored = new ArrayList<>();
        for (MemoryEntry entry : candidates) {
            scored.add(new ScoredMemory(entry, VectorUtils.cosine(vector, entry.getEmbedding())));
        }
        scored.sort(Comparator.comparingDouble(ScoredMemory::getSimilarity).reversed());
        return scored.size() > candidateLimit ? new ArrayList<>(scored.subList(0, candidateLimit)) : scored;
    }

    @Override
    public int deleteChainAfter(String chainId, int version) {
        return execute("回滚版本链", () -> memoryEntryRepository.deleteChainAfter(chainId, version));
    }

    private LambdaQueryWrapper<MemoryEntry> latestWrapper(String projectId, MemoryFilter filter) {
        LambdaQueryWrapper<MemoryEntry> wrapper = new LambdaQueryWrapper<MemoryEntry>()
            .eq(MemoryEntry::getProjectId, projectId)
            .notExists(LATEST_VERSION_ONLY);
        if (filter.getKinds() != null && !filter.getKinds().isEmpty()) {
            wrapper.in(MemoryEntry::getKind, filter.getKinds());
        }
        if (filter.getCreatedFrom() != null) {
            wrapper.ge(MemoryEntry::getCreatedAt, filter.getCreatedFrom());
        }
        if (filter.getCreatedTo() != null) {
            wrapper.le(MemoryEntry::getCreatedAt, filter.getCreatedTo());
        }
        return wrapper;
    }
}
