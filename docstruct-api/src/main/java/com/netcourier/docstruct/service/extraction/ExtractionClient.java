package com.netcourier.docstruct.service.extraction;

import com.netcourier.docstruct.model.ExtractionRequest;
import com.netcourier.docstruct.model.RawModelResponse;
import reactor.core.publisher.Mono;

public interface ExtractionClient {

    /**
     * Sends one chunk's prompt to the model.
     *
     * @return the raw response, or an error signal carrying {@link ExtractionFailedException} when the chunk
     * could not be processed, or {@link com.netcourier.docstruct.service.extraction.openai.ModelAuthenticationException}
     * when the credential was rejected
     */
    Mono<RawModelResponse> extract(ExtractionRequest request);
}
