package com.netcourier.docstruct.service.parsing;

import com.netcourier.docstruct.model.ExtractedRecord;
import com.netcourier.docstruct.model.ParseWarning;

import java.util.List;

public record ParseResult(List<ExtractedRecord> records, List<ParseWarning> warnings) {

    public ParseResult {
        records = records == null ? List.of() : List.copyOf(records);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
