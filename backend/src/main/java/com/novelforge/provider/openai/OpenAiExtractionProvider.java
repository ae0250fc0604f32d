package com.novelforge.provider.openai;

import com.novelforge.config.ProviderClientConfig;
import com.novelforge.model.fact.CandidateFact;
import com.novelforge.provider.CandidateFactParser;
import com.novelforge.provider.ExtractionProvider;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 事实抽取：让模型按固定 JSON 格式输出候选事实
 */
@Component
public class OpenAiExtractionProvider implements ExtractionProvider {

    private static final String SYSTEM_PROMPT = String.join("\n",
        "你是小说事实抽取器。阅读正文，输出 JSON：{\"facts\":[...]}，不要输出其他内容。",
        "每条事实必须带 kind 字段，取值与字段如下：",
        "- character_state: character, attributes(对象，如 {\"alive\":false})",
        "- location_change: character, location",
        "- rule_invocation: rule, actor, action",
        "- event: key(唯一英文键), type(如 death/speech/battle), participants(数组), subject, location, description",
        "- relation: source, target(形如 character:key), relation, attributes",
        "可选字段：sequence(叙事顺序号), flashback(回忆/倒叙为 true), evidence(原文依据)。",
        "角色、地点使用稳定的英文小写键。");

    private final OpenAiCompatibleClient client;
    private final ProviderClientConfig config;
    private final CandidateFactParser parser;

    public OpenAiExtractionProvider(OpenAiCompatibleClient client, ProviderClientConfig config,
                                    CandidateFactParser parser) {
        this.client = client;
        this.config = config;
        this.parser = parser;
    }

    @Override
    public List<CandidateFact> extract(String text, long sequence) {
        String userPrompt = "当前叙事顺序号: " + sequence + "\n\n正文：\n" + text;
        String raw = client.chat(config.getExtractionModel(), SYSTEM_PROMPT, userPrompt, 0.0);
        return parser.parse(raw, sequence);
    }
}
