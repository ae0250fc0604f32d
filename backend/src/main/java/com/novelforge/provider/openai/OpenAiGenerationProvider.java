package com.novelforge.provider.openai;

import com.novelforge.config.ProviderClientConfig;
import com.novelforge.provider.GenerationProvider;
import org.springframework.stereotype.Component;

/**
 * 正文生成
 */
@Component
public class OpenAiGenerationProvider implements GenerationProvider {

    private static final String SYSTEM_PROMPT =
        "你是一位长篇连载小说作者。严格遵守给出的设定、已发生事件和人物状态，"
            + "不得与既有事实矛盾；只输出正文，不要解释。";

    private final OpenAiCompatibleClient client;
    private final ProviderClientConfig config;

    public OpenAiGenerationProvider(OpenAiCompatibleClient client, ProviderClientConfig config) {
        this.client = client;
        this.config = config;
    }

    @Override
    public String generate(String context, String instruction) {
        String userPrompt = "【已知上下文】\n" + context + "\n\n【写作指令】\n" + instruction;
        return client.chat(config.getDefaultModel(), SYSTEM_PROMPT, userPrompt, 0.8);
    }
}
