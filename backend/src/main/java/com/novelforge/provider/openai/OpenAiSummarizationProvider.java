package com.novelforge.provider.openai;

import com.novelforge.config.ProviderClientConfig;
import com.novelforge.provider.SummarizationProvider;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * 递归摘要：旧摘要 + 新挤出的片段 → 新摘要
 */
@Component
public class OpenAiSummarizationProvider implements SummarizationProvider {

    private static final String SYSTEM_PROMPT =
        "你负责维护长篇小说的前情摘要。把新片段并入已有摘要，保留人物状态变化、关键事件、伏笔和世界规则，"
            + "删去修辞细节，输出不超过500字的摘要正文。";

    private final OpenAiCompatibleClient client;
    private final ProviderClientConfig config;

    public OpenAiSummarizationProvider(OpenAiCompatibleClient client, ProviderClientConfig config) {
        this.client = client;
        this.config = config;
    }

    @Override
    public String summarize(String evictedSegment, String previousSummary) {
        String userPrompt = "【已有摘要】\n" + StringUtils.defaultIfBlank(previousSummary, "（无）")
            + "\n\n【新片段】\n" + evictedSegment;
        return client.chat(config.getDefaultModel(), SYSTEM_PROMPT, userPrompt, 0.3);
    }
}
