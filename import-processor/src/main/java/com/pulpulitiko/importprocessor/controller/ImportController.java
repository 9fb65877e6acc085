package com.pulpulitiko.importprocessor.controller;

import com.pulpulitiko.importprocessor.domain.ImportRun;
import com.pulpulitiko.importprocessor.domain.ImportRunReport;
import com.pulpulitiko.importprocessor.domain.ImportRunStatus;
import com.pulpulitiko.importprocessor.dto.ErrorResponse;
import com.pulpulitiko.importprocessor.dto.ImportRunPage;
import com.pulpulitiko.importprocessor.exception.ImportRunNotFoundException;
import com.pulpulitiko.importprocessor.exception.ReportNotAvailableException;
import com.pulpulitiko.importprocessor.report.ErrorReportGenerator;
import com.pulpulitiko.importprocessor.service.ImportJobService;
import com.pulpulitiko.importprocessor.service.ImportRunService;
import com.pulpulitiko.importprocessor.service.ImportValidationService;
import com.pulpulitiko.importprocessor.service.OfficeholderExportService;
import com.pulpulitiko.importprocessor.spreadsheet.SpreadsheetFormatException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.JobExecutionException;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

/**
 * REST API for uploading officeholder spreadsheets and following their import runs.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/imports")
@RequiredArgsConstructor
@Tag(name = "Imports", description = "Upload, validate and track officeholder spreadsheet imports")
public class ImportController {

    static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    static final int DEFAULT_PER_PAGE = 20;
    static final int MAX_PER_PAGE = 100;

    private final ImportJobService importJobService;
    private final ImportValidationService importValidationService;
    private final ImportRunService importRunService;
    private final ErrorReportGenerator errorReportGenerator;
    private final OfficeholderExportService exportService;

    // ─── POST /api/v1/imports ─────────────────────────────────────────────────

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "Start an import",
            description = "Stores the spreadsheet and runs `officeholderImportJob` **asynchronously**. "
                    + "The response carries the `importRunId`; poll `GET /api/v1/imports/{id}` to track progress. "
                    + "Structural problems with the file (missing columns, no data rows) end the run as `FAILED`.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Import accepted and started in the background",
                            content = @Content(schema = @Schema(implementation = ImportAcceptedResponse.class))),
                    @ApiResponse(responseCode = "400", description = "No file or an empty file was uploaded",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            })
    public ResponseEntity<?> startImport(
            @Parameter(description = "The .xlsx or .xls spreadsheet", required = true)
            @RequestParam("file") MultipartFile file) throws IOException, JobExecutionException {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(new ErrorResponse("FILE_REQUIRED", "Uploaded file is empty"));
        }
        ImportRun run;
        try (InputStream content = file.getInputStream()) {
            run = importJobService.submit(file.getOriginalFilename(), content);
        }
        return ResponseEntity.accepted().body(new ImportAcceptedResponse(
                run.getId(), run.getJobExecutionId(), run.getStatus().name(), run.getFilename()));
    }

    // ─── POST /api/v1/imports/validate ────────────────────────────────────────

    @PostMapping(value = "/validate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "Validate a spreadsheet without importing",
            description = "Reads and validates every row against the reference catalog. Nothing is written to the registry.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Validation summary with every row error",
                            content = @Content(schema = @Schema(implementation = ImportRunReport.class))),
                    @ApiResponse(responseCode = "400", description = "The file is not a readable officeholder sheet",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
                    @ApiResponse(responseCode = "503", description = "Reference data could not be loaded",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            })
    public ResponseEntity<?> validate(
            @Parameter(description = "The .xlsx or .xls spreadsheet", required = true)
            @RequestParam("file") MultipartFile file) throws IOException, SpreadsheetFormatException {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(new ErrorResponse("FILE_REQUIRED", "Uploaded file is empty"));
        }
        try (InputStream content = file.getInputStream()) {
            return ResponseEntity.ok(importValidationService.validate(content));
        }
    }

    // ─── GET /api/v1/imports ──────────────────────────────────────────────────

    @GetMapping
    @Operation(
            summary = "List import runs",
            description = "One page of import runs, newest first. Row errors are left out; "
                    + "fetch a single run for its errors. An out-of-range `page` or `perPage` falls back "
                    + "to the default.")
    public ResponseEntity<ImportRunPage> listRuns(
            @Parameter(description = "1-based page number")
            @RequestParam(value = "page", defaultValue = "1") int page,
            @Parameter(description = "Runs per page, at most " + MAX_PER_PAGE)
            @RequestParam(value = "perPage", defaultValue = "20") int perPage) {
        int safePage = page > 0 ? page : 1;
        int safePerPage = perPage > 0 && perPage <= MAX_PER_PAGE ? perPage : DEFAULT_PER_PAGE;
        return ResponseEntity.ok(importRunService.list(safePage, safePerPage));
    }

    // ─── GET /api/v1/imports/{id} ─────────────────────────────────────────────

    @GetMapping("/{id}")
    @Operation(
            summary = "Get an import run",
            description = "Status, counters and every validation and reconciliation error of one run.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Import run found",
                            content = @Content(schema = @Schema(implementation = ImportRun.class))),
                    @ApiResponse(responseCode = "404", description = "Import run not found",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            })
    public ResponseEntity<ImportRun> getRun(
            @Parameter(name = "id", description = "The importRunId returned on upload", required = true)
            @PathVariable("id") String id) {
        return ResponseEntity.ok(importRunService.find(id).orElseThrow(() -> new ImportRunNotFoundException(id)));
    }

    // ─── GET /api/v1/imports/{id}/error-report ────────────────────────────────

    @GetMapping("/{id}/error-report")
    @Operation(
            summary = "Download the error report of a completed run",
            description = "Spreadsheet with the run summary, one line per validation error and a separate "
                    + "sheet of rows the registry rejected.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Error report workbook"),
                    @ApiResponse(responseCode = "404", description = "Import run not found",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
                    @ApiResponse(responseCode = "409", description = "The run is still in progress or failed",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            })
    public ResponseEntity<byte[]> errorReport(
            @Parameter(name = "id", description = "The importRunId returned on upload", required = true)
            @PathVariable("id") String id) throws IOException {
        ImportRun run = importRunService.find(id).orElseThrow(() -> new ImportRunNotFoundException(id));
        if (run.getStatus() != ImportRunStatus.COMPLETED) {
            throw new ReportNotAvailableException(id, run.getStatus());
        }
        return attachment("import_errors_" + id + ".xlsx", errorReportGenerator.generate(run));
    }

    // ─── GET /api/v1/imports/template ─────────────────────────────────────────

    @GetMapping("/template")
    @Operation(
            summary = "Download the import template",
            description = "Blank officeholder sheet with dropdowns fed by the current reference catalog.")
    public ResponseEntity<byte[]> template() throws IOException {
        return attachment("politician_import_template.xlsx", exportService.importTemplate());
    }

    static ResponseEntity<byte[]> attachment(String filename, byte[] body) {
        return ResponseEntity.ok()
                .contentType(XLSX)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(filename).build().toString())
                .body(body);
    }

    // ─── Response records ─────────────────────────────────────────────────────

    public record ImportAcceptedResponse(String importRunId, Long jobExecutionId, String status, String filename) {}
}
