package com.netcourier.docstruct.controller;

import com.netcourier.docstruct.model.ExtractTextRequest;
import com.netcourier.docstruct.model.ExtractionDocument;
import com.netcourier.docstruct.model.ExtractionResponse;
import com.netcourier.docstruct.model.ExtractionResult;
import com.netcourier.docstruct.service.DocumentProcessingException;
import com.netcourier.docstruct.service.ExtractionService;
import com.netcourier.docstruct.service.export.SpreadsheetExporter;
import jakarta.validation.Valid;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.UUID;

@RestController
@RequestMapping("/api/extractions")
@Validated
public class ExtractionController {

    static final MediaType XLSX = MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final ExtractionService extractionService;
    private final SpreadsheetExporter spreadsheetExporter;

    public ExtractionController(ExtractionService extractionService, SpreadsheetExporter spreadsheetExporter) {
        this.extractionService = extractionService;
        this.spreadsheetExporter = spreadsheetExporter;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ExtractionResponse> extract(@RequestPart("file") FilePart file) {
        return runOnUpload(file).map(ExtractionResponse::from);
    }

    @PostMapping(path = "/xlsx", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<byte[]>> extractToSpreadsheet(@RequestPart("file") FilePart file) {
        return runOnUpload(file)
                .map(result -> spreadsheetExporter.export(result.rows()))
                .map(bytes -> ResponseEntity.ok()
                        .contentType(XLSX)
                        .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                                .filename(SpreadsheetExporter.FILE_NAME)
                                .build()
                                .toString())
                        .body(bytes));
    }

    @PostMapping(path = "/text", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ExtractionResponse> extractText(@Valid @RequestBody ExtractTextRequest request) {
        String documentId = request.documentId() == null || request.documentId().isBlank()
                ? UUID.randomUUID().toString()
                : request.documentId().strip();
        ExtractionDocument document = new ExtractionDocument(documentId, request.text());
        return Mono.fromCallable(() -> extractionService.extract(document))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ExtractionResponse::from);
    }

    private Mono<ExtractionResult> runOnUpload(FilePart file) {
        if (file == null) {
            return Mono.error(new DocumentProcessingException(HttpStatus.BAD_REQUEST, "File payload is required"));
        }
        return DataBufferUtils.join(file.content())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .publishOn(Schedulers.boundedElastic())
                .map(bytes -> extractionService.extractPdf(file.filename(), bytes));
    }
}
