package com.novelforge.provider;

import com.novelforge.model.fact.CandidateFact;

import java.util.List;

/**
 * 事实抽取服务：从生成文本中抽取候选事实
 */
public interface ExtractionProvider {

    /**
     * @param sequence 当前请求的叙事顺序号，抽取结果未标注顺序时使用
     */
    List<CandidateFact> extract(String text, long sequence);
}
