package com.netcourier.docstruct.model;

import java.util.Objects;

public record ExtractionDocument(String documentId, String text) {

    public ExtractionDocument {
        Objects.requireNonNull(documentId, "documentId");
        text = text == null ? "" : text;
    }
}
