package com.pulpulitiko.importprocessor.exception;

import com.pulpulitiko.importprocessor.catalog.ReferenceDataException;
import com.pulpulitiko.importprocessor.dto.ErrorResponse;
import com.pulpulitiko.importprocessor.reconcile.RegistryException;
import com.pulpulitiko.importprocessor.spreadsheet.SpreadsheetFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.JobExecutionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SpreadsheetFormatException.class)
    public ResponseEntity<ErrorResponse> handleSpreadsheetFormat(SpreadsheetFormatException e) {
        log.info("Rejected spreadsheet: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(e.getReason().name(), e.getMessage()));
    }

    @ExceptionHandler(ImportRunNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleRunNotFound(ImportRunNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("IMPORT_RUN_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(ReportNotAvailableException.class)
    public ResponseEntity<ErrorResponse> handleReportNotAvailable(ReportNotAvailableException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("REPORT_NOT_AVAILABLE", e.getMessage()));
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingFile(MissingServletRequestPartException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("FILE_REQUIRED", "Multipart part '%s' is required".formatted(e.getRequestPartName())));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(MaxUploadSizeExceededException e) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(new ErrorResponse("FILE_TOO_LARGE", e.getMessage()));
    }

    @ExceptionHandler(ReferenceDataException.class)
    public ResponseEntity<ErrorResponse> handleReferenceData(ReferenceDataException e) {
        log.warn("Reference data unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("REFERENCE_DATA_UNAVAILABLE", e.getMessage()));
    }

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<ErrorResponse> handleRegistry(RegistryException e) {
        log.warn("Registry call failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("REGISTRY_UNAVAILABLE", e.getMessage()));
    }

    @ExceptionHandler(JobExecutionException.class)
    public ResponseEntity<ErrorResponse> handleJobLaunch(JobExecutionException e) {
        log.error("Failed to start import job: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("JOB_LAUNCH_FAILED", e.getMessage()));
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleIo(IOException e) {
        log.error("I/O failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("IO_ERROR", e.getMessage()));
    }
}
