package com.netcourier.docstruct.service.extraction;

import com.netcourier.docstruct.service.extraction.openai.OpenAiChatClient;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OpenAiModelClientTest {

    private final OpenAiChatClient chatClient = mock(OpenAiChatClient.class);
    private final OpenAiModelClient modelClient = new OpenAiModelClient(chatClient, "llama-3.3-70b-versatile", 0.1);

    @Test
    void sendsPromptAsSingleUserMessage() {
        when(chatClient.complete(any())).thenReturn(Mono.just(response("  Key: City | Value: Jaipur | Comment:\n", "stop")));

        StepVerifier.create(modelClient.complete("Extract this", 3000))
                .expectNext("Key: City | Value: Jaipur | Comment:")
                .verifyComplete();

        ArgumentCaptor<OpenAiChatClient.Request> captor = ArgumentCaptor.forClass(OpenAiChatClient.Request.class);
        verify(chatClient).complete(captor.capture());
        OpenAiChatClient.Request request = captor.getValue();
        assertThat(request.model()).isEqualTo("llama-3.3-70b-versatile");
        assertThat(request.temperature()).isEqualTo(0.1);
        assertThat(request.maxTokens()).isEqualTo(3000);
        assertThat(request.messages()).containsExactly(new OpenAiChatClient.Message("user", "Extract this"));
    }

    @Test
    void missingChoiceYieldsEmptyText() {
        when(chatClient.complete(any())).thenReturn(Mono.just(new OpenAiChatClient.ChatCompletionResponse(List.of(), null)));

        StepVerifier.create(modelClient.complete("Extract this", 3000))
                .expectNext("")
                .verifyComplete();
    }

    @Test
    void truncatedAnswerIsStillReturned() {
        when(chatClient.complete(any())).thenReturn(Mono.just(response("Key: Name | Value: Jane", "length")));

        StepVerifier.create(modelClient.complete("Extract this", 256))
                .expectNext("Key: Name | Value: Jane")
                .verifyComplete();
    }

    private static OpenAiChatClient.ChatCompletionResponse response(String content, String finishReason) {
        return new OpenAiChatClient.ChatCompletionResponse(
                List.of(new OpenAiChatClient.Choice(new OpenAiChatClient.Message("assistant", content), finishReason)),
                null);
    }
}
