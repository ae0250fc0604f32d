package com.novelforge.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAI 兼容接口的客户端配置
 */
@Configuration
public class ProviderClientConfig {

    @Value("${ai.base-url:https://api.openai.com}")
    private String baseUrl;

    @Value("${ai.api-key:}")
    private String apiKey;

    @Value("${ai.default-model:gpt-4o-mini}")
    private String defaultModel;

    @Value("${ai.extraction-model:${ai.default-model:gpt-4o-mini}}")
    private String extractionModel;

    @Value("${ai.embedding-model:text-embedding-3-small}")
    private String embeddingModel;

    @Value("${ai.connect-timeout-ms:15000}")
    private int connectTimeoutMs;

    @Value("${ai.read-timeout-ms:120000}")
    private int readTimeoutMs;

    public String getBaseUrl() { return baseUrl; }
    public String getApiKey() { return apiKey; }
    public String getDefaultModel() { return defaultModel; }
    public String getExtractionModel() { return extractionModel; }
    public String getEmbeddingModel() { return embeddingModel; }
    public int getConnectTimeoutMs() { return connectTimeoutMs; }
    public int getReadTimeoutMs() { return readTimeoutMs; }
}
