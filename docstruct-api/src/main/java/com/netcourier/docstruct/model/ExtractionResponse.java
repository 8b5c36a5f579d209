package com.netcourier.docstruct.model;

import java.util.List;

public record ExtractionResponse(String documentId,
                                 List<OutputRow> rows,
                                 ExtractionSummary summary) {

    public static ExtractionResponse from(ExtractionResult result) {
        return new ExtractionResponse(result.documentId(), result.rows(), result.summary());
    }
}
