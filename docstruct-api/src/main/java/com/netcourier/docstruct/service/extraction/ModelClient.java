package com.netcourier.docstruct.service.extraction;

import reactor.core.publisher.Mono;

/**
 * Boundary to the hosted language model: one prompt in, the model's free text out.
 */
public interface ModelClient {

    Mono<String> complete(String prompt, int maxOutputTokens);
}
