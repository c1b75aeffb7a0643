package com.cfoPilot.aiCfo.llm.client;

import com.cfoPilot.aiCfo.llm.dto.ChatCompletionRequest;
import com.cfoPilot.aiCfo.llm.dto.ChatCompletionResponse;
import com.cfoPilot.aiCfo.llm.exception.LlmCallException;
import com.cfoPilot.aiCfo.llm.exception.LlmRateLimitedException;
import com.cfoPilot.aiCfo.llm.model.LlmRequest;
import com.cfoPilot.aiCfo.llm.model.LlmResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Client for OpenAI-compatible chat completions endpoints (OpenAI, Groq, local gateways).
 * Maps HTTP failures onto {@link LlmRateLimitedException} and {@link LlmCallException}.
 */
@Slf4j
@Service
public class OpenAiCompatibleLlmClient implements LlmClient {

    private static final String COMPLETIONS_PATH = "/chat/completions";

    private final RestClient restClient;
    private final String apiKey;
    private final String model;
    private final Double temperature;
    private final Integer maxTokens;

    public OpenAiCompatibleLlmClient(
            @Value("${ai-cfo.llm.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${ai-cfo.llm.api-key:}") String apiKey,
            @Value("${ai-cfo.llm.model:gpt-4o-mini}") String model,
            @Value("${ai-cfo.llm.temperature:0.3}") Double temperature,
            @Value("${ai-cfo.llm.max-tokens:2000}") Integer maxTokens,
            @Value("${ai-cfo.llm.connect-timeout:3s}") Duration connectTimeout,
            @Value("${ai-cfo.llm.read-timeout:30s}") Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        this.restClient = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String modelName() {
        return model;
    }

    /**
     * Sends a system + user message pair and returns the first choice's content.
     *
     * @param request Prompt, optional system prompt and sampling overrides
     * @return Content, model name and token usage
     * @throws LlmRateLimitedException on 429 or a quota-worded 403
     * @throws LlmCallException on any other failure
     */
    @Override
    public LlmResponse call(LlmRequest request) {
        if (!isConfigured()) {
            throw new LlmCallException("LLM client not configured. Set ai-cfo.llm.api-key in application.yaml");
        }

        List<ChatCompletionRequest.Message> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(ChatCompletionRequest.Message.builder()
                    .role("system")
                    .content(request.getSystemPrompt())
                    .build());
        }
        messages.add(ChatCompletionRequest.Message.builder()
                .role("user")
                .content(request.getPrompt())
                .build());

        ChatCompletionRequest body = ChatCompletionRequest.builder()
                .model(model)
                .messages(messages)
                .temperature(request.getTemperature() != null ? request.getTemperature() : temperature)
                .maxTokens(request.getMaxTokens() != null ? request.getMaxTokens() : maxTokens)
                .stream(false)
                .responseFormat(request.isJsonResponse() ? new ChatCompletionRequest.ResponseFormat("json_object") : null)
                .build();

        ChatCompletionResponse response;
        try {
            log.debug("Calling LLM - model: {}, prompt length: {}", model,
                    request.getPrompt() != null ? request.getPrompt().length() : 0);

            response = restClient.post()
                    .uri(COMPLETIONS_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(body)
                    .retrieve()
                    .body(ChatCompletionResponse.class);
        } catch (RestClientResponseException e) {
            throw mapHttpFailure(e);
        } catch (RestClientException e) {
            log.error("Transport error calling LLM", e);
            throw new LlmCallException("Failed to call LLM: " + e.getMessage(), e);
        }

        if (response == null || response.getContent() == null) {
            throw new LlmCallException("LLM returned an empty response");
        }

        ChatCompletionResponse.Usage usage = response.getUsage();
        log.debug("LLM response received - model: {}, tokens used: {}",
                response.getModel(), usage != null ? usage.getTotalTokens() : "unknown");

        return LlmResponse.builder()
                .content(response.getContent())
                .model(response.getModel() != null ? response.getModel() : model)
                .promptTokens(usage != null ? usage.getPromptTokens() : null)
                .completionTokens(usage != null ? usage.getCompletionTokens() : null)
                .totalTokens(usage != null ? usage.getTotalTokens() : null)
                .build();
    }

    static LlmCallException mapHttpFailure(RestClientResponseException e) {
        int status = e.getStatusCode().value();
        String body = e.getResponseBodyAsString().toLowerCase(Locale.ROOT);

        if (status == 429) {
            log.warn("LLM rate limited (429)");
            return new LlmRateLimitedException("LLM rate limit exceeded", status);
        }
        if (status == 403 && (body.contains("quota") || body.contains("rate"))) {
            log.warn("LLM quota exhausted (403)");
            return new LlmRateLimitedException("LLM quota exceeded", status);
        }
        if (status == 401) {
            log.error("LLM rejected credentials (401)");
            return new LlmCallException("LLM authentication failed", e);
        }
        log.error("LLM call failed with HTTP {}", status);
        return new LlmCallException("LLM call failed with HTTP " + status, e);
    }
}
