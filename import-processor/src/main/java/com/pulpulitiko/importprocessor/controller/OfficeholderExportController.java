package com.pulpulitiko.importprocessor.controller;

import com.pulpulitiko.importprocessor.dto.ErrorResponse;
import com.pulpulitiko.importprocessor.service.OfficeholderExportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.time.LocalDate;

@RestController
@RequestMapping("/api/v1/officeholders")
@RequiredArgsConstructor
@Tag(name = "Officeholders", description = "Export the current officeholders")
public class OfficeholderExportController {

    private final OfficeholderExportService exportService;

    @GetMapping("/export")
    @Operation(
            summary = "Export current officeholders",
            description = "One row per current assignment in the import layout. Uploading the file unchanged "
                    + "reports every row as unchanged.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Export workbook"),
                    @ApiResponse(responseCode = "502", description = "The registry could not be read",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
                    @ApiResponse(responseCode = "503", description = "Reference data could not be loaded",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            })
    public ResponseEntity<byte[]> export() throws IOException {
        return ImportController.attachment("officeholders_" + LocalDate.now() + ".xlsx",
                exportService.exportCurrentOfficeholders());
    }
}
