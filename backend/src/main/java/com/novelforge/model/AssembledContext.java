package com.novelforge.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 组装后的有界上下文
 */
@Data
@AllArgsConstructor
public class AssembledContext {

    private String text;

    private int tokens;

    private int tokenBudget;

    private List<ContextSegment> included;

    /**
     * 因预算不足被整段丢弃的片段数
     */
    private int droppedSegments;
}
