package com.netcourier.docstruct.model;

public record ChunkOverflow(int unitIndex, int estimatedTokens, int tokenBudget, String preview) {
}
