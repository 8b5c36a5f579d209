package com.netcourier.docstruct.model;

public record ChunkFailure(int chunkIndex, int attempts, String reason) {

    public static ChunkFailure notDispatched(int chunkIndex) {
        return new ChunkFailure(chunkIndex, 0, "Run aborted before dispatch");
    }

    /**
     * The request was sent but the run was aborted before it answered. At least one attempt was made.
     */
    public static ChunkFailure cancelledInFlight(int chunkIndex) {
        return new ChunkFailure(chunkIndex, 1, "Cancelled in flight after run aborted");
    }
}
