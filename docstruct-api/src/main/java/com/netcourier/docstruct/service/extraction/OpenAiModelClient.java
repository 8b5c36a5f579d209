package com.netcourier.docstruct.service.extraction;

import com.netcourier.docstruct.service.extraction.openai.OpenAiChatClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

@Component
public class OpenAiModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiModelClient.class);

    private final OpenAiChatClient chatClient;
    private final String model;
    private final double temperature;

    public OpenAiModelClient(OpenAiChatClient chatClient,
                             @Value("${docstruct.llm.model:llama-3.3-70b-versatile}") String model,
                             @Value("${docstruct.llm.temperature:0.1}") double temperature) {
        this.chatClient = chatClient;
        this.model = Objects.requireNonNullElse(model, "llama-3.3-70b-versatile");
        this.temperature = temperature;
    }

    @Override
    public Mono<String> complete(String prompt, int maxOutputTokens) {
        OpenAiChatClient.Request request = new OpenAiChatClient.Request(
                model,
                List.of(new OpenAiChatClient.Message("user", prompt)),
                temperature,
                maxOutputTokens
        );
        return chatClient.complete(request)
                .map(response -> {
                    OpenAiChatClient.Choice choice = response.firstChoice();
                    if (choice == null || choice.message() == null || choice.message().content() == null) {
                        log.warn("Chat completion for model {} returned no content", model);
                        return "";
                    }
                    if ("length".equals(choice.finishReason())) {
                        log.warn("Chat completion for model {} was truncated at {} output tokens", model, maxOutputTokens);
                    }
                    return choice.message().content().strip();
                });
    }
}
