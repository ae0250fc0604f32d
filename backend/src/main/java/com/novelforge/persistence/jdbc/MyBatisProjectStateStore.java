package com.novelforge.persistence.jdbc;

import com.novelforge.domain.entity.ProjectMemoryState;
import com.novelforge.persistence.ProjectStateStore;
import com.novelforge.repository.ProjectMemoryStateRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

@Component
@ConditionalOnProperty(name = "novel.memory.persistence", havingValue = "jdbc", matchIfMissing = true)
public class MyBatisProjectStateStore extends MyBatisStoreSupport implements ProjectStateStore {

    private final ProjectMemoryStateRepository stateRepository;

    public MyBatisProjectStateStore(ProjectMemoryStateRepository stateRepository) {
        this.stateRepository = stateRepository;
    }

    @Override
    public ProjectMemoryState load(String projectId) {
        ProjectMemoryState state = execute("读取项目状态", () -> stateRepository.selectById(projectId));
        return state != null ? state : new ProjectMemoryState(projectId);
    }

    @Override
    public void save(ProjectMemoryState state) {
        state.setUpdatedAt(LocalDateTime.now());
        run("保存项目状态", () -> {
            if (stateRepository.selectById(state.getProjectId()) == null) {
                stateRepository.insert(state);
            } else {
                stateRepository.updateById(state);
            }
        });
    }
}
