package com.netcourier.docstruct.service.ingestion;

import com.netcourier.docstruct.service.DocumentProcessingException;
import org.apache.commons.io.FilenameUtils;
import org.apache.tika.exception.EncryptedDocumentException;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.PagedText;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * PDF text extraction through Tika. No OCR: a scanned PDF without a text layer is rejected.
 */
@Component
public class TikaDocumentTextExtractor implements DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TikaDocumentTextExtractor.class);
    static final String PDF_CONTENT_TYPE = "application/pdf";

    private final AutoDetectParser parser = new AutoDetectParser();

    @Override
    public ExtractedText extract(String filename, InputStream inputStream) {
        BodyContentHandler handler = new BodyContentHandler(-1);
        Metadata metadata = new Metadata();
        if (filename != null) {
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
        }
        try {
            parser.parse(inputStream, handler, metadata, new ParseContext());
        } catch (EncryptedDocumentException e) {
            throw new DocumentProcessingException(HttpStatus.UNPROCESSABLE_ENTITY, "PDF is encrypted and cannot be read", e);
        } catch (IOException | SAXException | TikaException e) {
            log.error("Failed to extract text from document {}", filename, e);
            throw new DocumentProcessingException(HttpStatus.UNPROCESSABLE_ENTITY, "Failed to extract document text", e);
        }

        String contentType = Optional.ofNullable(metadata.get(Metadata.CONTENT_TYPE)).orElse("");
        if (!contentType.startsWith(PDF_CONTENT_TYPE)) {
            throw new DocumentProcessingException(HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                    "Only PDF documents are supported but received " + (contentType.isBlank() ? "unknown content" : contentType));
        }
        String text = normalizeLines(handler.toString());
        if (text.isBlank()) {
            throw new DocumentProcessingException(HttpStatus.UNPROCESSABLE_ENTITY,
                    "Document did not contain extractable text (scanned PDFs are not supported)");
        }
        Integer pages = metadata.getInt(PagedText.N_PAGES);
        String title = Optional.ofNullable(metadata.get(TikaCoreProperties.TITLE))
                .filter(value -> !value.isBlank())
                .orElseGet(() -> defaultTitle(filename));
        log.info("Extracted {} characters from {} ({} pages)", text.length(), filename, pages == null ? "?" : pages);
        return new ExtractedText(title, contentType, pages == null ? 0 : pages, text);
    }

    @Override
    public ExtractedText extractText(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new DocumentProcessingException(HttpStatus.NOT_FOUND, "PDF not found: " + path);
        }
        try (InputStream inputStream = Files.newInputStream(path)) {
            return extract(path.getFileName().toString(), inputStream);
        } catch (IOException e) {
            throw new DocumentProcessingException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read " + path, e);
        }
    }

    /**
     * Trims trailing spaces and squeezes runs of blank lines into one blank line, so paragraph breaks survive
     * for chunking.
     */
    private String normalizeLines(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r\n", "\n")
                .replaceAll("[ \\t\\x0B\\f]+\n", "\n")
                .replaceAll("\n{3,}", "\n\n")
                .strip();
    }

    private String defaultTitle(String filename) {
        if (filename == null || filename.isBlank()) {
            return "Document";
        }
        String baseName = FilenameUtils.getBaseName(filename);
        return baseName.isBlank() ? "Document" : baseName;
    }
}
