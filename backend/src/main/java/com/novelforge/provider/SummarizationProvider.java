package com.novelforge.provider;

/**
 * 滚动摘要服务：把被挤出窗口的片段并入已有摘要
 */
public interface SummarizationProvider {

    /**
     * @param previousSummary 之前的滚动摘要，首次为空
     */
    String summarize(String evictedSegment, String previousSummary);
}
