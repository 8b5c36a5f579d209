package com.netcourier.docstruct.model;

public record ParseWarning(int chunkIndex, Type type, String line, String message) {

    public enum Type {
        MALFORMED_LINE,
        NO_RECORDS_PARSED
    }

    public static ParseWarning malformed(int chunkIndex, String line, String message) {
        return new ParseWarning(chunkIndex, Type.MALFORMED_LINE, line, message);
    }

    public static ParseWarning noRecords(int chunkIndex) {
        return new ParseWarning(chunkIndex, Type.NO_RECORDS_PARSED, null,
                "Model response was not empty but no records could be recovered");
    }
}
