package com.netcourier.docstruct.service;

import com.netcourier.docstruct.model.ExtractionDocument;
import com.netcourier.docstruct.model.ExtractionResult;

import java.nio.file.Path;

public interface ExtractionService {

    ExtractionResult extract(ExtractionDocument document);

    ExtractionResult extractPdf(String filename, byte[] bytes);

    ExtractionResult extractPdf(Path path);
}
