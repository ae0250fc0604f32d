package com.novelforge.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 一致性校验结果：全部发现 + 暂存的图谱变更
 */
@Data
@AllArgsConstructor
public class CheckResult {

    private List<ConsistencyFinding> findings;

    private StagedGraphChanges stagedChanges;

    public boolean hasBlocking() {
        return findings.stream().anyMatch(ConsistencyFinding::isBlocking);
    }
}
