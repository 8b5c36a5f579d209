package com.netcourier.docstruct.service.export;

import com.netcourier.docstruct.model.OutputRow;

import java.util.List;

public interface SpreadsheetExporter {

    String FILE_NAME = "Output.xlsx";

    byte[] export(List<OutputRow> rows);
}
