package com.ai.salesagent.service;

import com.ai.salesagent.conversation.ChatMessage;
import com.ai.salesagent.exception.LlmUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * OpenAI Chat Completions client, blocking and streamed.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private static final String STREAM_DATA_PREFIX = "data:";
    private static final String STREAM_DONE = "[DONE]";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    private final String apiKey;
    private final String model;
    private final String baseUrl;
    private final double defaultTemperature;

    public LlmService(RestTemplateBuilder builder,
                      @Value("${openai.api-key:}") String apiKey,
                      @Value("${openai.model:gpt-4o-mini}") String model,
                      @Value("${openai.base-url:https://api.openai.com/v1}") String baseUrl,
                      @Value("${openai.temperature:0.7}") double defaultTemperature,
                      @Value("${openai.timeout-seconds:60}") long timeoutSeconds) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(20))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
        this.apiKey = apiKey;
        this.model = model;
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
        this.defaultTemperature = defaultTemperature;
    }

    public boolean isConfigured() {
        return StringUtils.isNotBlank(apiKey);
    }

    public String complete(List<ChatMessage> messages) {
        return complete(messages, defaultTemperature);
    }

    /** Single user prompt, no system message. */
    public String complete(String prompt, double temperature) {
        return complete(List.of(ChatMessage.user(prompt)), temperature);
    }

    public String complete(List<ChatMessage> messages, double temperature) {
        requireConfigured();
        Map<String, Object> body = requestBody(messages, temperature, false);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + "/chat/completions", new HttpEntity<>(body, headers()), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            String content = root.path("choices").path(0).path("message").path("content").asText("").trim();
            log.debug("LLM reply ({} chars)", content.length());
            return content;
        } catch (RestClientException | IOException ex) {
            throw new LlmUnavailableException("Chat completion failed", ex);
        }
    }

    /**
     * Streams the completion, handing each content delta to {@code onChunk}.
     *
     * @return the concatenated reply
     */
    public String stream(List<ChatMessage> messages, Consumer<String> onChunk) {
        requireConfigured();
        Map<String, Object> body = requestBody(messages, defaultTemperature, true);
        StringBuilder full = new StringBuilder();
        try {
            restTemplate.execute(baseUrl + "/chat/completions", HttpMethod.POST,
                    request -> {
                        request.getHeaders().putAll(headers());
                        request.getBody().write(mapper.writeValueAsBytes(body));
                    },
                    response -> {
                        try (BufferedReader reader = new BufferedReader(
                                new InputStreamReader(response.getBody(), StandardCharsets.UTF_8))) {
                            String line;
                            while ((line = reader.readLine()) != null) {
                                String chunk = parseStreamLine(line);
                                if (chunk == null) {
                                    if (line.trim().endsWith(STREAM_DONE)) break;
                                    continue;
                                }
                                full.append(chunk);
                                onChunk.accept(chunk);
                            }
                        }
                        return null;
                    });
        } catch (RestClientException ex) {
            throw new LlmUnavailableException("Streaming chat completion failed", ex);
        }
        return full.toString();
    }

    /**
     * Content delta carried by one SSE line of a streamed completion, or null for
     * keep-alives, the terminator and deltas without content.
     */
    String parseStreamLine(String line) {
        if (line == null) return null;
        String trimmed = line.trim();
        if (!trimmed.startsWith(STREAM_DATA_PREFIX)) return null;
        String payload = trimmed.substring(STREAM_DATA_PREFIX.length()).trim();
        if (payload.isEmpty() || STREAM_DONE.equals(payload)) return null;
        try {
            JsonNode delta = mapper.readTree(payload).path("choices").path(0).path("delta").path("content");
            if (delta.isMissingNode() || delta.isNull()) return null;
            String text = delta.asText("");
            return text.isEmpty() ? null : text;
        } catch (IOException e) {
            log.warn("Skipping unreadable stream chunk: {}", StringUtils.abbreviate(payload, 120));
            return null;
        }
    }

    private Map<String, Object> requestBody(List<ChatMessage> messages, double temperature, boolean stream) {
        List<Map<String, String>> payload = new ArrayList<>();
        for (ChatMessage msg : messages) {
            Map<String, String> m = new HashMap<>();
            m.put("role", msg.getRole());
            m.put("content", msg.getContent());
            payload.add(m);
        }
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", temperature);
        body.put("messages", payload);
        if (stream) body.put("stream", true);
        return body;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    private void requireConfigured() {
        if (!isConfigured()) {
            log.error("OPENAI_API_KEY is not set");
            throw new LlmUnavailableException("OpenAI API key is not configured");
        }
    }
}
