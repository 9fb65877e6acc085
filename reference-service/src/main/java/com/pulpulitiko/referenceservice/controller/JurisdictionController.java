package com.pulpulitiko.referenceservice.controller;

import com.pulpulitiko.referenceservice.dto.JurisdictionResponse;
import com.pulpulitiko.referenceservice.service.JurisdictionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the jurisdiction directory.
 */
@RestController
@RequestMapping("/api/v1/reference/jurisdictions")
@RequiredArgsConstructor
@Tag(name = "Jurisdictions", description = "Resolve regions, provinces, cities, barangays and districts by name or id")
public class JurisdictionController {

    private final JurisdictionService jurisdictionService;

    @GetMapping(value = "/{type}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "List jurisdictions of a type",
            description = "Returns all jurisdictions of the given type. Unknown types yield an empty list."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Jurisdictions of the requested type",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            array = @ArraySchema(schema = @Schema(implementation = JurisdictionResponse.class))
                    )
            )
    })
    public ResponseEntity<List<JurisdictionResponse>> getByType(
            @Parameter(name = "type", description = "Jurisdiction type", example = "province", required = true)
            @PathVariable("type") String type) {
        return ResponseEntity.ok(jurisdictionService.getByType(type));
    }

    @GetMapping(value = "/{type}/lookup", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Look up a jurisdiction by name",
            description = "Exact, case-insensitive match on the jurisdiction name within the given type."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Jurisdiction found",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = JurisdictionResponse.class)
                    )
            ),
            @ApiResponse(responseCode = "404", description = "No jurisdiction of that type has the name")
    })
    public ResponseEntity<JurisdictionResponse> lookup(
            @Parameter(name = "type", description = "Jurisdiction type", example = "province", required = true)
            @PathVariable("type") String type,
            @Parameter(name = "name", description = "Jurisdiction name (case-insensitive)", example = "Cebu", required = true)
            @RequestParam("name") String name) {
        return jurisdictionService.lookup(type, name)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/{type}/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get a jurisdiction by id")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Jurisdiction found",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = JurisdictionResponse.class)
                    )
            ),
            @ApiResponse(responseCode = "404", description = "Jurisdiction not found")
    })
    public ResponseEntity<JurisdictionResponse> getById(
            @PathVariable("type") String type,
            @PathVariable("id") String id) {
        return jurisdictionService.findById(type, id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
