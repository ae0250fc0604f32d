package com.novelforge.provider.openai;

import com.novelforge.common.exception.EmbeddingException;
import com.novelforge.common.exception.NovelMemoryException;
import com.novelforge.config.ProviderClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI 兼容接口的 HTTP 客户端（/v1/chat/completions、/v1/embeddings）
 */
@Component
public class OpenAiCompatibleClient {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiCompatibleClient.class);

    private final ProviderClientConfig config;
    private final RestTemplate restTemplate;

    public OpenAiCompatibleClient(ProviderClientConfig config) {
        this.config = config;
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout(config.getConnectTimeoutMs());
        f.setReadTimeout(config.getReadTimeoutMs());
        this.restTemplate = new RestTemplate(f);
    }

    @SuppressWarnings("unchecked")
    public String chat(String model, String systemPrompt, String userPrompt, double temperature) {
        List<Map<String, Object>> messages = new ArrayList<>();
        messages.add(message("system", systemPrompt));
        messages.add(message("user", userPrompt));

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("temperature", temperature);

        Map<String, Object> response = post("/v1/chat/completions", body);
        List<Map<String, Object>> choices = response != null ? (List<Map<String, Object>>) response.get("choices") : null;
        if (choices == null || choices.isEmpty()) {
            throw new NovelMemoryException("模型返回为空: model=" + model, "PROVIDER_ERROR");
        }
        Map<String, Object> msg = (Map<String, Object>) choices.get(0).get("message");
        Object content = msg != null ? msg.get("content") : null;
        if (content == null) {
            throw new NovelMemoryException("模型返回缺少content: model=" + model, "PROVIDER_ERROR");
        }
        return content.toString();
    }

    @SuppressWarnings("unchecked")
    public float[] embed(String model, String text, int dimensions) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("input", text);
        if (dimensions > 0) {
            body.put("dimensions", dimensions);
        }

        Map<String, Object> response = post("/v1/embeddings", body);
        List<Map<String, Object>> data = response != null ? (List<Map<String, Object>>) response.get("data") : null;
        if (data == null || data.isEmpty()) {
            throw new EmbeddingException("向量化接口返回为空: model=" + model);
        }
        List<Number> values = (List<Number>) data.get(0).get("embedding");
        if (values == null || values.isEmpty()) {
            throw new EmbeddingException("向量化接口缺少embedding字段: model=" + model);
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < values.size(); i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> post(String path, Map<String, Object> body) {
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        if (config.getApiKey() != null && !config.getApiKey().isEmpty()) {
            h.setBearerAuth(config.getApiKey());
        }
        String url = endpoint(path);
        logger.debug("调用模型接口: {}", url);
        return restTemplate.postForObject(url, new HttpEntity<>(body, h), Map.class);
    }

    private String endpoint(String path) {
        String base = config.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (base.endsWith("/v1")) {
            base = base.substring(0, base.length() - 3);
        }
        return base + path;
    }

    private Map<String, Object> message(String role, String content) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", role);
        m.put("content", content);
        return m;
    }
}
