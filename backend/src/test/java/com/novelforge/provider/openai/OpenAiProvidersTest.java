package com.novelforge.provider.openai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.config.MemoryProperties;
import com.novelforge.config.ProviderClientConfig;
import com.novelforge.model.fact.CandidateFact;
import com.novelforge.model.fact.EventFact;
import com.novelforge.provider.CandidateFactParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpenAiProvidersTest {

    @Mock
    private OpenAiCompatibleClient client;

    @Mock
    private ProviderClientConfig config;

    private final ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);

    @Test
    void extractionParsesTheModelAnswerWithTheRequestSequence() {
        when(config.getExtractionModel()).thenReturn("extract-model");
        when(client.chat(eq("extract-model"), anyString(), contains("当前叙事顺序号: 2001"), eq(0.0)))
            .thenReturn("{\"facts\":[{\"kind\":\"event\",\"key\":\"speak\",\"type\":\"speech\","
                + "\"participants\":[\"lihang\"]}]}");
        OpenAiExtractionProvider provider =
            new OpenAiExtractionProvider(client, config, new CandidateFactParser(new ObjectMapper()));

        List<CandidateFact> facts = provider.extract("李航开口说话。", 2001L);

        assertThat(facts).hasSize(1);
        EventFact event = (EventFact) facts.get(0);
        assertThat(event.getEventKey()).isEqualTo("speak");
        assertThat(event.getSequence()).isEqualTo(2001L);
    }

    @Test
    void generationSendsContextAndInstruction() {
        when(config.getDefaultModel()).thenReturn("writer-model");
        when(client.chat(eq("writer-model"), anyString(), userPrompt.capture(), eq(0.8))).thenReturn("正文");
        OpenAiGenerationProvider provider = new OpenAiGenerationProvider(client, config);

        assertThat(provider.generate("李航已筑基", "写第二章")).isEqualTo("正文");
        assertThat(userPrompt.getValue()).isEqualTo("【已知上下文】\n李航已筑基\n\n【写作指令】\n写第二章");
    }

    @Test
    void summarizationMarksMissingPreviousSummary() {
        when(config.getDefaultModel()).thenReturn("writer-model");
        when(client.chat(eq("writer-model"), anyString(), userPrompt.capture(), eq(0.3))).thenReturn("新摘要");
        OpenAiSummarizationProvider provider = new OpenAiSummarizationProvider(client, config);

        assertThat(provider.summarize("李航下山", null)).isEqualTo("新摘要");
        assertThat(userPrompt.getValue()).isEqualTo("【已有摘要】\n（无）\n\n【新片段】\n李航下山");
    }

    @Test
    void embeddingRequestsTheConfiguredDimension() {
        when(config.getEmbeddingModel()).thenReturn("embed-model");
        MemoryProperties properties = new MemoryProperties();
        properties.setEmbeddingDimension(64);
        float[] vector = new float[64];
        when(client.embed("embed-model", "李航", 64)).thenReturn(vector);
        OpenAiEmbeddingProvider provider = new OpenAiEmbeddingProvider(client, config, properties);

        assertThat(provider.embed("李航")).isSameAs(vector);
        verify(client).embed("embed-model", "李航", 64);
    }
}
