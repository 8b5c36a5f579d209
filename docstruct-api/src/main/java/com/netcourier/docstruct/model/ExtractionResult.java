package com.netcourier.docstruct.model;

import java.util.List;

public record ExtractionResult(String documentId, List<OutputRow> rows, ExtractionSummary summary) {

    public ExtractionResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
