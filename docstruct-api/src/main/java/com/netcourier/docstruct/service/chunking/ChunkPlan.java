package com.netcourier.docstruct.service.chunking;

import com.netcourier.docstruct.model.ChunkOverflow;
import com.netcourier.docstruct.model.TextChunk;

import java.util.List;

public record ChunkPlan(List<TextChunk> chunks, List<ChunkOverflow> overflows) {

    public ChunkPlan {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        overflows = overflows == null ? List.of() : List.copyOf(overflows);
    }

    public static ChunkPlan empty() {
        return new ChunkPlan(List.of(), List.of());
    }
}
