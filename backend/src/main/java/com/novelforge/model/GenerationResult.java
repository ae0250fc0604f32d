package com.novelforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 生成请求的当前状态/最终结果
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResult {

    private String requestId;

    private String projectId;

    private RequestState state;

    /**
     * 最近一次生成的文本
     */
    private String text;

    private List<ConsistencyFinding> findings;

    /**
     * 提交后的记忆条目ID
     */
    private String memoryEntryId;

    /**
     * 提交后的项目图谱版本
     */
    private Long graphVersion;

    /**
     * 生成尝试次数（含一致性重试）
     */
    private int attempts;

    private String failureReason;

    private LocalDateTime updatedAt;
}
