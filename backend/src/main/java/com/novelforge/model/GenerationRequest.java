package com.novelforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import java.util.List;
import java.util.Map;

/**
 * 章节/场景生成请求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationRequest {

    @NotBlank(message = "projectId不能为空")
    private String projectId;

    @Min(value = 1, message = "chapterNumber必须大于0")
    private Integer chapterNumber;

    private Integer sceneNumber;

    /**
     * 写作指令
     */
    @NotBlank(message = "instruction不能为空")
    private String instruction;

    /**
     * 本章/本场景大纲
     */
    private String outline;

    /**
     * 检索查询文本，为空时使用指令+大纲
     */
    private String query;

    /**
     * 必须保留的设定（最高优先级）
     */
    private List<String> pinnedFacts;

    /**
     * 图谱种子键（type:key 或 key），用于拉取相关实体事实
     */
    private List<String> focusKeys;

    @Min(value = 1, message = "topK必须大于0")
    private Integer topK;

    @Min(value = 1, message = "tokenBudget必须大于0")
    private Integer tokenBudget;

    /**
     * 叙事顺序号；为空时由章节号与场景号推导
     */
    private Long narrativeSequence;

    /**
     * 提交时写入的记忆类型，默认 event
     */
    private MemoryKind memoryKind;

    private Map<String, Object> metadata;

    public long resolveSequence() {
        if (narrativeSequence != null) {
            return narrativeSequence;
        }
        long chapter = chapterNumber != null ? chapterNumber : 0;
        long scene = sceneNumber != null ? sceneNumber : 0;
        return chapter * 1000 + scene;
    }

    public String resolveQuery() {
        if (query != null && !query.trim().isEmpty()) {
            return query;
        }
        return outline != null ? instruction + "\n" + outline : instruction;
    }
}
