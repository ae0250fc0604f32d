package com.novelforge.provider.openai;

import com.novelforge.config.MemoryProperties;
import com.novelforge.config.ProviderClientConfig;
import com.novelforge.provider.EmbeddingProvider;
import org.springframework.stereotype.Component;

/**
 * 向量化，按配置的维度请求（text-embedding-3 系列支持 dimensions 参数）
 */
@Component
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private final OpenAiCompatibleClient client;
    private final ProviderClientConfig config;
    private final MemoryProperties properties;

    public OpenAiEmbeddingProvider(OpenAiCompatibleClient client, ProviderClientConfig config,
                                   MemoryProperties properties) {
        this.client = client;
        this.config = config;
        this.properties = properties;
    }

    @Override
    public float[] embed(String text) {
        return client.embed(config.getEmbeddingModel(), text, properties.getEmbeddingDimension());
    }
}
