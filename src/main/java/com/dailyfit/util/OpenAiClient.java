package com.dailyfit.util;

import com.dailyfit.common.exception.ConfigurationException;
import com.dailyfit.common.exception.GenerationFailedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * OpenAI Chat Completions 客户端
 * 默认只调用一次；重试次数与退避时间由配置决定
 */
@Slf4j
@Component
public class OpenAiClient {

    private static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json; charset=utf-8");
    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1/chat/completions";
    private static final String DEFAULT_MODEL = "gpt-4o-mini";
    private static final double DEFAULT_TEMPERATURE = 0.7;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final int maxAttempts;
    private final long backoffMs;
    private final Integer maxTokens;

    public OpenAiClient(@Value("${app.ai.openai.api-key:}") String apiKey,
                        @Value("${app.ai.openai.base-url:" + DEFAULT_BASE_URL + "}") String baseUrl,
                        @Value("${app.ai.openai.timeout.connect-ms:5000}") long connectTimeoutMs,
                        @Value("${app.ai.openai.timeout.read-ms:30000}") long readTimeoutMs,
                        @Value("${app.ai.openai.timeout.write-ms:30000}") long writeTimeoutMs,
                        @Value("${app.ai.openai.timeout.call-ms:60000}") long callTimeoutMs,
                        @Value("${app.ai.openai.retry.max-attempts:1}") int maxAttempts,
                        @Value("${app.ai.openai.retry.backoff-ms:500}") long backoffMs,
                        @Value("${app.ai.openai.chat.max-tokens:400}") Integer maxTokens,
                        ObjectMapper objectMapper) {
        if (StringUtils.isBlank(apiKey)) {
            throw new ConfigurationException("OpenAI API key is not configured, set app.ai.openai.api-key or OPENAI_API_KEY");
        }
        this.objectMapper = objectMapper;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS)
                .writeTimeout(writeTimeoutMs, TimeUnit.MILLISECONDS)
                .callTimeout(callTimeoutMs, TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(false)
                .build();
        this.apiKey = apiKey.trim();
        this.baseUrl = StringUtils.defaultIfBlank(baseUrl, DEFAULT_BASE_URL);
        this.maxAttempts = Math.max(maxAttempts, 1);
        this.backoffMs = Math.max(backoffMs, 0L);
        this.maxTokens = maxTokens != null && maxTokens > 0 ? maxTokens : null;
        log.info("OpenAiClient 初始化完成，baseUrl={}, maxAttempts={}", this.baseUrl, this.maxAttempts);
    }

    /**
     * 单轮生成，不带 system prompt
     */
    public String generate(String prompt, String model, Double temperature) {
        return chat(null, prompt, model, temperature);
    }

    public String chat(String systemPrompt, String userPrompt) {
        return chat(systemPrompt, userPrompt, null, null);
    }

    public String chat(String systemPrompt, String userPrompt, String model, Double temperature) {
        Map<String, Object> payload = buildPayload(systemPrompt, userPrompt, model, temperature);
        String jsonBody;
        try {
            jsonBody = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new GenerationFailedException("Failed to build generation request: " + e.getMessage(), e);
        }

        for (int attempt = 1; ; attempt++) {
            Request request = new Request.Builder()
                    .url(baseUrl)
                    .addHeader("Authorization", "Bearer " + apiKey)
                    .addHeader("Content-Type", "application/json")
                    .post(RequestBody.create(jsonBody, JSON_MEDIA_TYPE))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                String responseText = response.body() != null ? response.body().string() : "";
                if (response.isSuccessful()) {
                    return parseContent(responseText);
                }
                log.error("调用OpenAI失败，code={}, body={}, attempt={}/{}", response.code(), responseText, attempt, maxAttempts);
                if (!isRetryableStatus(response.code()) || attempt >= maxAttempts) {
                    throw new GenerationFailedException("Generation service returned HTTP " + response.code());
                }
            } catch (IOException e) {
                log.warn("调用OpenAI异常，attempt={}/{}: {}", attempt, maxAttempts, e.getMessage());
                if (attempt >= maxAttempts) {
                    throw new GenerationFailedException("Generation request failed: " + e.getMessage(), e);
                }
            }
            sleepBeforeRetry(attempt);
        }
    }

    private Map<String, Object> buildPayload(String systemPrompt, String userPrompt, String model, Double temperature) {
        if (StringUtils.isBlank(userPrompt)) {
            throw new IllegalArgumentException("userPrompt must not be blank");
        }
        List<Map<String, String>> messages = new ArrayList<>();
        if (StringUtils.isNotBlank(systemPrompt)) {
            Map<String, String> system = new HashMap<>();
            system.put("role", "system");
            system.put("content", systemPrompt);
            messages.add(system);
        }
        Map<String, String> user = new HashMap<>();
        user.put("role", "user");
        user.put("content", userPrompt);
        messages.add(user);

        Map<String, Object> payload = new HashMap<>();
        payload.put("model", StringUtils.defaultIfBlank(model, DEFAULT_MODEL));
        payload.put("messages", messages);
        payload.put("temperature", temperature != null ? temperature : DEFAULT_TEMPERATURE);
        if (maxTokens != null) {
            payload.put("max_tokens", maxTokens);
        }
        return payload;
    }

    private String parseContent(String responseText) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseText);
        } catch (JsonProcessingException e) {
            throw new GenerationFailedException("Generation service returned malformed JSON", e);
        }
        JsonNode errorNode = root.get("error");
        if (errorNode != null && !errorNode.isNull()) {
            String errorMessage = errorNode.has("message") ? errorNode.get("message").asText() : errorNode.toString();
            throw new GenerationFailedException("Generation service returned error: " + errorMessage);
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new GenerationFailedException("Generation service returned no choices");
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new GenerationFailedException("Generation service returned empty content");
        }
        return content.asText();
    }

    private static boolean isRetryableStatus(int code) {
        return code == 429 || code >= 500;
    }

    /**
     * 线性退避 + 随机抖动
     */
    private void sleepBeforeRetry(int attempt) {
        if (backoffMs == 0) {
            return;
        }
        long delay = backoffMs * attempt + ThreadLocalRandom.current().nextLong(backoffMs + 1);
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new GenerationFailedException("Interrupted while waiting to retry generation", ie);
        }
    }
}
