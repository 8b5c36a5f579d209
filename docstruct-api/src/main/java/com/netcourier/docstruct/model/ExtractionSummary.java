package com.netcourier.docstruct.model;

import java.util.List;

public record ExtractionSummary(String documentId,
                                int totalChunks,
                                int processedChunks,
                                int extractedRecords,
                                int conflicts,
                                boolean aborted,
                                List<ChunkFailure> skippedChunks,
                                List<ChunkOverflow> overflows,
                                List<ParseWarning> parseWarnings) {

    public ExtractionSummary {
        skippedChunks = skippedChunks == null ? List.of() : List.copyOf(skippedChunks);
        overflows = overflows == null ? List.of() : List.copyOf(overflows);
        parseWarnings = parseWarnings == null ? List.of() : List.copyOf(parseWarnings);
    }

    public boolean complete() {
        return !aborted && skippedChunks.isEmpty() && overflows.isEmpty();
    }
}
