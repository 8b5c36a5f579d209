package com.netcourier.docstruct.service.extraction.openai;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Minimal client for an OpenAI compatible {@code /v1/chat/completions} endpoint (Groq by default).
 * Failures are translated into {@link LlmInvocationException} flagged as retryable or not.
 */
@Component
public class OpenAiChatClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);

    private final WebClient webClient;
    private final Duration timeout;

    public OpenAiChatClient(@Qualifier("llmWebClient") WebClient webClient,
                            @Value("${docstruct.llm.timeout-seconds:60}") long timeoutSeconds) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    public Mono<ChatCompletionResponse> complete(Request request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", request.model());
        payload.put("messages", request.messages());
        payload.put("stream", Boolean.FALSE);
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null) {
            payload.put("max_tokens", request.maxTokens());
        }

        return webClient.post()
                .uri("/v1/chat/completions")
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .timeout(timeout)
                .onErrorMap(ex -> !(ex instanceof LlmInvocationException), this::translate);
    }

    private LlmInvocationException translate(Throwable error) {
        if (error instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            log.warn("LLM chat completion returned {}: {}", status, responseException.getResponseBodyAsString());
            if (status == 401 || status == 403) {
                return new ModelAuthenticationException("Model endpoint rejected the credential (" + status + ")", error);
            }
            boolean retryable = status == 429 || status >= 500;
            return new LlmInvocationException("Chat completion returned " + status, retryable, error);
        }
        if (error instanceof WebClientRequestException) {
            log.warn("LLM chat completion request failed: {}", error.getMessage());
            return new LlmInvocationException("Chat completion request failed: " + error.getMessage(), true, error);
        }
        if (error instanceof TimeoutException) {
            return new LlmInvocationException("Chat completion timed out after " + timeout.toSeconds() + "s", true, error);
        }
        log.warn("LLM chat completion failed: {}", error.getMessage(), error);
        return new LlmInvocationException("Failed to invoke chat completion", false, error);
    }

    public record Request(String model,
                          List<Message> messages,
                          Double temperature,
                          Integer maxTokens) {
    }

    public record Message(String role, String content) {
    }

    public record ChatCompletionResponse(List<Choice> choices, Usage usage) {

        public Choice firstChoice() {
            return choices == null || choices.isEmpty() ? null : choices.get(0);
        }
    }

    public record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {
    }

    public record Usage(@JsonProperty("total_tokens") int totalTokens,
                        @JsonProperty("prompt_tokens") int promptTokens,
                        @JsonProperty("completion_tokens") int completionTokens) {
    }
}
