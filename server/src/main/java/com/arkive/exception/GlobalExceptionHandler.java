package com.arkive.exception;

import com.arkive.models.dto.response.ResponseTemplate;
import com.arkive.spi.exceptions.AuditWriteException;
import com.arkive.spi.exceptions.BackupException;
import com.arkive.spi.exceptions.ContentionException;
import com.arkive.spi.exceptions.DuplicateRecordException;
import com.arkive.spi.exceptions.IntegrityValidationException;
import com.arkive.spi.exceptions.RecordNotFoundException;
import com.arkive.spi.exceptions.StorageException;
import com.arkive.spi.exceptions.StorageInitException;
import com.arkive.spi.exceptions.ValidationFailure;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps store failures raised under a controller to status codes and {@link ResponseTemplate} error bodies.
 * Anything not handled here falls through to {@link ArkiveErrorController}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    public static final String INTEGRITY_VIOLATION = "INTEGRITY_VIOLATION";
    public static final String STORE_BUSY = "STORE_BUSY";
    public static final String AUDIT_WRITE_FAILED = "AUDIT_WRITE_FAILED";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String CONFLICT = "CONFLICT";
    public static final String BACKUP_FAILED = "BACKUP_FAILED";
    public static final String STORAGE_ERROR = "STORAGE_ERROR";
    public static final String BAD_REQUEST = "BAD_REQUEST";

    @ExceptionHandler(IntegrityValidationException.class)
    public ResponseEntity<ResponseTemplate<ValidationFailure>> handleIntegrityValidation(IntegrityValidationException e) {
        HttpStatus status = e.getFailure() == ValidationFailure.MISSING_ARCHIVE ? HttpStatus.NOT_FOUND : HttpStatus.UNPROCESSABLE_ENTITY;
        log.warn("Integrity validation failed with {}: {}", e.getFailure(), e.getMessage());
        return ResponseEntity.status(status).body(ResponseTemplate.error(e.getFailure(), e.getMessage(), INTEGRITY_VIOLATION));
    }

    @ExceptionHandler(ContentionException.class)
    public ResponseEntity<ResponseTemplate<Void>> handleContention(ContentionException e) {
        log.warn("Store busy after {} attempts", e.getAttempts());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ResponseTemplate.error(e.getMessage(), STORE_BUSY));
    }

    @ExceptionHandler(AuditWriteException.class)
    public ResponseEntity<ResponseTemplate<Void>> handleAuditWrite(AuditWriteException e) {
        log.error("Audit entry could not be recorded", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ResponseTemplate.error(e.getMessage(), AUDIT_WRITE_FAILED));
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<ResponseTemplate<Void>> handleNotFound(RecordNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ResponseTemplate.error(e.getMessage(), NOT_FOUND));
    }

    @ExceptionHandler(DuplicateRecordException.class)
    public ResponseEntity<ResponseTemplate<Void>> handleDuplicate(DuplicateRecordException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ResponseTemplate.error(e.getMessage(), CONFLICT));
    }

    @ExceptionHandler(BackupException.class)
    public ResponseEntity<ResponseTemplate<Void>> handleBackup(BackupException e) {
        log.error("Backup operation failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ResponseTemplate.error(e.getMessage(), BACKUP_FAILED));
    }

    @ExceptionHandler({StorageException.class, StorageInitException.class})
    public ResponseEntity<ResponseTemplate<Void>> handleStorage(RuntimeException e) {
        log.error("Store operation failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ResponseTemplate.error(e.getMessage(), STORAGE_ERROR));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ResponseTemplate<Void>> handleConstraintViolation(ConstraintViolationException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ResponseTemplate.error(e.getMessage(), BAD_REQUEST));
    }
}
