package com.netcourier.docstruct.service.ingestion;

import java.io.InputStream;
import java.nio.file.Path;

public interface DocumentTextExtractor {

    ExtractedText extract(String filename, InputStream inputStream);

    ExtractedText extractText(Path path);

    record ExtractedText(String title, String contentType, int pages, String text) {}
}
