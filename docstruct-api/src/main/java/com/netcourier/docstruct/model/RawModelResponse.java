package com.netcourier.docstruct.model;

import java.time.Instant;

public record RawModelResponse(int chunkIndex, String text, Instant receivedAt) {
}
