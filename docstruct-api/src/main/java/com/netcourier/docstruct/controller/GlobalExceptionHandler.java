package com.netcourier.docstruct.controller;

import com.netcourier.docstruct.service.DocumentProcessingException;
import com.netcourier.docstruct.service.extraction.openai.ModelAuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DocumentProcessingException.class)
    public ResponseEntity<Map<String, Object>> handleDocumentProcessingException(DocumentProcessingException exception) {
        return ResponseEntity.status(exception.status())
                .body(Map.of(
                        "error", exception.getMessage()
                ));
    }

    @ExceptionHandler(ModelAuthenticationException.class)
    public ResponseEntity<Map<String, Object>> handleModelAuthenticationException(ModelAuthenticationException exception) {
        log.error("Extraction run aborted: {}", exception.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(Map.of(
                        "error", "The language model rejected the configured credential"
                ));
    }
}
