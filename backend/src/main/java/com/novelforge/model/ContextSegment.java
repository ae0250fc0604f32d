package com.novelforge.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 上下文片段，截断只发生在片段边界
 */
@Data
@AllArgsConstructor
public class ContextSegment {

    public enum Source {
        /** 必须保留的设定与图谱事实 */
        PINNED,
        /** 检索到的长期记忆（含滚动摘要） */
        RETRIEVED,
        /** 大纲 */
        OUTLINE,
        /** 滑动窗口中的近期原文 */
        RECENT
    }

    private Source source;

    private String text;
}
