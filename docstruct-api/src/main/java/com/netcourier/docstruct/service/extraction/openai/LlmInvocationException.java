package com.netcourier.docstruct.service.extraction.openai;

public class LlmInvocationException extends RuntimeException {

    private final boolean retryable;

    public LlmInvocationException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public LlmInvocationException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
