package com.netcourier.docstruct.model;

public record ExtractionRequest(TextChunk chunk, String promptText) {

    public int chunkIndex() {
        return chunk.index();
    }
}
