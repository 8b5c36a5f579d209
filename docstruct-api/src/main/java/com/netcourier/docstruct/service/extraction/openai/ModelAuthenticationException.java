package com.netcourier.docstruct.service.extraction.openai;

/**
 * The model endpoint rejected the configured credential. Never retried; ends the whole run.
 */
public class ModelAuthenticationException extends LlmInvocationException {

    public ModelAuthenticationException(String message, Throwable cause) {
        super(message, false, cause);
    }
}
