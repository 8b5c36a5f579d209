package com.netcourier.docstruct.model;

public record TextChunk(int index, String text, int estimatedTokens) {
}
