package com.netcourier.docstruct.service.extraction;

import com.netcourier.docstruct.model.ExtractionRequest;
import com.netcourier.docstruct.model.TextChunk;
import com.netcourier.docstruct.service.extraction.openai.LlmInvocationException;
import com.netcourier.docstruct.service.extraction.openai.ModelAuthenticationException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RetryingExtractionClientTest {

    private static final Instant NOW = Instant.parse("2024-01-05T10:15:30Z");

    private final ExtractionRequest request = new ExtractionRequest(new TextChunk(4, "Name: Jane Doe", 4), "prompt");

    @Test
    void retriesTransientFailuresUntilTheModelAnswers() {
        AtomicInteger calls = new AtomicInteger();
        ModelClient modelClient = (prompt, maxTokens) -> calls.incrementAndGet() < 3
                ? Mono.error(new LlmInvocationException("Chat completion returned 503", true))
                : Mono.just("Key: Name | Value: Jane Doe | Comment:");

        StepVerifier.create(client(modelClient, 3, Duration.ofSeconds(5)).extract(request))
                .assertNext(response -> {
                    assertThat(response.chunkIndex()).isEqualTo(4);
                    assertThat(response.text()).isEqualTo("Key: Name | Value: Jane Doe | Comment:");
                    assertThat(response.receivedAt()).isEqualTo(NOW);
                })
                .verifyComplete();
        assertThat(calls).hasValue(3);
    }

    @Test
    void backoffDoublesBetweenAttempts() {
        AtomicInteger calls = new AtomicInteger();
        ModelClient modelClient = (prompt, maxTokens) -> calls.incrementAndGet() < 3
                ? Mono.error(new LlmInvocationException("Chat completion returned 503", true))
                : Mono.just("Key: Name | Value: Jane Doe | Comment:");
        RetryingExtractionClient client = new RetryingExtractionClient(modelClient, 3, Duration.ofSeconds(1),
                Duration.ofSeconds(30), Duration.ofSeconds(120), 3000, Clock.fixed(NOW, ZoneOffset.UTC));

        StepVerifier.withVirtualTime(() -> client.extract(request))
                .expectSubscription()
                .then(() -> assertThat(calls).hasValue(1))
                .thenAwait(Duration.ofMillis(999))
                .then(() -> assertThat(calls).hasValue(1))
                .thenAwait(Duration.ofMillis(1))
                .then(() -> assertThat(calls).hasValue(2))
                .thenAwait(Duration.ofMillis(1999))
                .then(() -> assertThat(calls).hasValue(2))
                .thenAwait(Duration.ofMillis(1))
                .then(() -> assertThat(calls).hasValue(3))
                .assertNext(response -> assertThat(response.text()).isEqualTo("Key: Name | Value: Jane Doe | Comment:"))
                .verifyComplete();
    }

    @Test
    void exhaustedRetriesReportTheAttemptCount() {
        AtomicInteger calls = new AtomicInteger();
        ModelClient modelClient = (prompt, maxTokens) -> {
            calls.incrementAndGet();
            return Mono.error(new LlmInvocationException("Chat completion returned 429", true));
        };

        StepVerifier.create(client(modelClient, 3, Duration.ofSeconds(5)).extract(request))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ExtractionFailedException.class);
                    ExtractionFailedException failure = (ExtractionFailedException) error;
                    assertThat(failure.chunkIndex()).isEqualTo(4);
                    assertThat(failure.attempts()).isEqualTo(3);
                    assertThat(failure.reason()).isEqualTo("Chat completion returned 429");
                })
                .verify();
        assertThat(calls).hasValue(3);
    }

    @Test
    void permanentFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        ModelClient modelClient = (prompt, maxTokens) -> {
            calls.incrementAndGet();
            return Mono.error(new LlmInvocationException("Chat completion returned 400", false));
        };

        StepVerifier.create(client(modelClient, 3, Duration.ofSeconds(5)).extract(request))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOfSatisfying(ExtractionFailedException.class,
                                failure -> assertThat(failure.attempts()).isEqualTo(1)))
                .verify();
        assertThat(calls).hasValue(1);
    }

    @Test
    void rejectedCredentialPropagatesUntouched() {
        AtomicInteger calls = new AtomicInteger();
        ModelClient modelClient = (prompt, maxTokens) -> {
            calls.incrementAndGet();
            return Mono.error(new ModelAuthenticationException("Model endpoint rejected the credential (401)", null));
        };

        StepVerifier.create(client(modelClient, 3, Duration.ofSeconds(5)).extract(request))
                .expectError(ModelAuthenticationException.class)
                .verify();
        assertThat(calls).hasValue(1);
    }

    @Test
    void totalTimeoutEndsTheCall() {
        ModelClient modelClient = (prompt, maxTokens) -> Mono.never();

        StepVerifier.create(client(modelClient, 3, Duration.ofMillis(100)).extract(request))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ExtractionFailedException.class);
                    assertThat(error.getCause()).isInstanceOf(TimeoutException.class);
                    assertThat(((ExtractionFailedException) error).attempts()).isEqualTo(1);
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void outputTokenLimitIsPassedToTheModel() {
        AtomicInteger requestedTokens = new AtomicInteger();
        ModelClient modelClient = (prompt, maxTokens) -> {
            requestedTokens.set(maxTokens);
            return Mono.just("");
        };

        StepVerifier.create(client(modelClient, 1, Duration.ofSeconds(5)).extract(request))
                .expectNextCount(1)
                .verifyComplete();
        assertThat(requestedTokens).hasValue(3000);
    }

    @Test
    void onlyRetryableFailuresAreTransient() {
        assertThat(RetryingExtractionClient.isTransient(new LlmInvocationException("busy", true))).isTrue();
        assertThat(RetryingExtractionClient.isTransient(new TimeoutException())).isTrue();
        assertThat(RetryingExtractionClient.isTransient(new LlmInvocationException("bad request", false))).isFalse();
        assertThat(RetryingExtractionClient.isTransient(new ModelAuthenticationException("denied", null))).isFalse();
        assertThat(RetryingExtractionClient.isTransient(new IllegalStateException())).isFalse();
    }

    private RetryingExtractionClient client(ModelClient modelClient, int maxAttempts, Duration totalTimeout) {
        return new RetryingExtractionClient(modelClient, maxAttempts, Duration.ofMillis(1), Duration.ofMillis(5),
                totalTimeout, 3000, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
