package com.netcourier.docstruct.model;

/**
 * One key/value/comment triple recovered from a model response. The value is kept exactly as the
 * model wrote it, dates included.
 */
public record ExtractedRecord(String key, String value, String comment, int sourceChunkIndex) {

    public ExtractedRecord {
        key = key == null ? "" : key.trim();
        value = value == null ? "" : value.trim();
        comment = comment == null ? "" : comment.trim();
    }
}
