package com.netcourier.docstruct.service.extraction;

public class ExtractionFailedException extends RuntimeException {

    private final int chunkIndex;
    private final int attempts;

    public ExtractionFailedException(int chunkIndex, int attempts, Throwable lastError) {
        super("Extraction failed for chunk " + chunkIndex + " after " + attempts + " attempt(s): " + describe(lastError), lastError);
        this.chunkIndex = chunkIndex;
        this.attempts = attempts;
    }

    public int chunkIndex() {
        return chunkIndex;
    }

    public int attempts() {
        return attempts;
    }

    public String reason() {
        return describe(getCause());
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
