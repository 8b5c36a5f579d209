package com.netcourier.docstruct.service.extraction;

import com.netcourier.docstruct.model.ExtractionRequest;
import com.netcourier.docstruct.model.RawModelResponse;
import com.netcourier.docstruct.service.extraction.openai.LlmInvocationException;
import com.netcourier.docstruct.service.extraction.openai.ModelAuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls the model for one chunk with bounded exponential backoff. The attempt counter lives inside each
 * call, so concurrent chunks never share retry state.
 */
public class RetryingExtractionClient implements ExtractionClient {

    private static final Logger log = LoggerFactory.getLogger(RetryingExtractionClient.class);

    private final ModelClient modelClient;
    private final int maxAttempts;
    private final Duration backoffBase;
    private final Duration maxBackoff;
    private final Duration totalTimeout;
    private final int maxOutputTokens;
    private final Clock clock;

    public RetryingExtractionClient(ModelClient modelClient,
                                    int maxAttempts,
                                    Duration backoffBase,
                                    Duration maxBackoff,
                                    Duration totalTimeout,
                                    int maxOutputTokens,
                                    Clock clock) {
        this.modelClient = Objects.requireNonNull(modelClient, "modelClient");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffBase = backoffBase;
        this.maxBackoff = maxBackoff.compareTo(backoffBase) < 0 ? backoffBase : maxBackoff;
        this.totalTimeout = totalTimeout;
        this.maxOutputTokens = Math.max(256, maxOutputTokens);
        this.clock = clock;
    }

    @Override
    public Mono<RawModelResponse> extract(ExtractionRequest request) {
        int chunkIndex = request.chunkIndex();
        AtomicInteger attempts = new AtomicInteger();
        return Mono.defer(() -> {
                    int attempt = attempts.incrementAndGet();
                    log.info("Requesting extraction for chunk {} (attempt {}/{})", chunkIndex, attempt, maxAttempts);
                    return modelClient.complete(request.promptText(), maxOutputTokens);
                })
                .retryWhen(Retry.backoff(maxAttempts - 1L, backoffBase)
                        .maxBackoff(maxBackoff)
                        .jitter(0d)
                        .filter(RetryingExtractionClient::isTransient)
                        .doBeforeRetry(signal -> log.warn("Chunk {} attempt {}/{} failed, retrying: {}",
                                chunkIndex, signal.totalRetries() + 1, maxAttempts, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .timeout(totalTimeout)
                .map(text -> new RawModelResponse(chunkIndex, text, clock.instant()))
                .doOnNext(response -> log.debug("Chunk {} answered after {} attempt(s)", chunkIndex, attempts.get()))
                .onErrorMap(error -> !(error instanceof ModelAuthenticationException), error -> {
                    Throwable cause = error instanceof TimeoutException
                            ? new TimeoutException("No successful response within " + totalTimeout.toMillis() + "ms")
                            : error;
                    log.warn("Giving up on chunk {} after {} attempt(s): {}", chunkIndex, attempts.get(), cause.getMessage());
                    return new ExtractionFailedException(chunkIndex, attempts.get(), cause);
                })
                .doOnError(ModelAuthenticationException.class,
                        error -> log.error("Credential rejected while extracting chunk {}", chunkIndex));
    }

    static boolean isTransient(Throwable error) {
        return error instanceof LlmInvocationException invocation && invocation.retryable()
                || error instanceof TimeoutException;
    }
}
