package com.genomics.controller;

import com.genomics.error.ConstraintViolationException;
import com.genomics.error.DuplicateRecordException;
import com.genomics.error.GenomicsException;
import com.genomics.error.RecordNotFoundException;
import com.genomics.error.StorageUnavailableException;
import com.genomics.error.TransactionAbortedException;
import com.genomics.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the {@link GenomicsException} hierarchy to HTTP statuses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException e) {
        Map<String, Object> body = body("VALIDATION", e);
        body.put("field", e.getField());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "VALIDATION");
        body.put("message", "malformed request body");
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(RecordNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("NOT_FOUND", e));
    }

    @ExceptionHandler({DuplicateRecordException.class, ConstraintViolationException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(GenomicsException e) {
        String error = e instanceof DuplicateRecordException ? "DUPLICATE" : "CONSTRAINT_VIOLATION";
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body(error, e));
    }

    @ExceptionHandler(TransactionAbortedException.class)
    public ResponseEntity<Map<String, Object>> handleAborted(TransactionAbortedException e) {
        log.warn("Transaction aborted at operation {}: {}", e.getFailedOperation(), e.getCause().getMessage());
        Map<String, Object> body = body("TRANSACTION_ABORTED", e);
        body.put("failedOperation", e.getFailedOperation());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(StorageUnavailableException e) {
        log.error("Storage unavailable", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body("STORAGE_UNAVAILABLE", e));
    }

    private static Map<String, Object> body(String error, Exception e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", e.getMessage());
        return body;
    }
}
