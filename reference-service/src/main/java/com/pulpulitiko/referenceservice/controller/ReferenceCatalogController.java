package com.pulpulitiko.referenceservice.controller;

import com.pulpulitiko.referenceservice.dto.PartyResponse;
import com.pulpulitiko.referenceservice.dto.PositionResponse;
import com.pulpulitiko.referenceservice.service.ReferenceCatalogService;
import io.swagger.v3.oas.annotations.Operation;
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
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller exposing the position and party catalogs.
 */
@RestController
@RequestMapping("/api/v1/reference")
@RequiredArgsConstructor
@Tag(name = "Reference Catalog", description = "Positions and parties that import rows are validated against")
public class ReferenceCatalogController {

    private final ReferenceCatalogService referenceCatalogService;

    @GetMapping(value = "/positions", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "List all positions",
            description = "Returns every position an officeholder can be imported into, in catalog order."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Successfully retrieved the list of positions",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            array = @ArraySchema(schema = @Schema(implementation = PositionResponse.class))
                    )
            )
    })
    public ResponseEntity<List<PositionResponse>> getAllPositions() {
        return ResponseEntity.ok(referenceCatalogService.getAllPositions());
    }

    @GetMapping(value = "/parties", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "List all parties",
            description = "Returns every registered political party, in catalog order."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Successfully retrieved the list of parties",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            array = @ArraySchema(schema = @Schema(implementation = PartyResponse.class))
                    )
            )
    })
    public ResponseEntity<List<PartyResponse>> getAllParties() {
        return ResponseEntity.ok(referenceCatalogService.getAllParties());
    }
}
