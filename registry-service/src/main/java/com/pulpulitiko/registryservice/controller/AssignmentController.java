package com.pulpulitiko.registryservice.controller;

import com.pulpulitiko.registryservice.dto.AssignmentResponse;
import com.pulpulitiko.registryservice.dto.CloseAssignmentRequest;
import com.pulpulitiko.registryservice.dto.CreateAssignmentRequest;
import com.pulpulitiko.registryservice.dto.ErrorResponse;
import com.pulpulitiko.registryservice.dto.ReplaceAssignmentRequest;
import com.pulpulitiko.registryservice.dto.UpdateAssignmentRequest;
import com.pulpulitiko.registryservice.service.OfficeholderRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for officeholder assignments.
 *
 * <p>Writes that would leave two current holders for one position and jurisdiction
 * are answered with {@code 409 Conflict}.
 */
@RestController
@RequestMapping("/api/v1/registry/assignments")
@RequiredArgsConstructor
@Tag(name = "Assignments", description = "Current and archived officeholder assignments")
public class AssignmentController {

    private final OfficeholderRegistryService registryService;

    @GetMapping(value = "/current", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get the current holder of a position in a jurisdiction")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Current holder found",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = AssignmentResponse.class))),
            @ApiResponse(responseCode = "404", description = "The position is vacant")
    })
    public ResponseEntity<AssignmentResponse> getCurrent(
            @Parameter(description = "Position id", required = true)
            @RequestParam("positionId") String positionId,
            @Parameter(description = "Jurisdiction type", example = "province", required = true)
            @RequestParam("jurisdictionType") String jurisdictionType,
            @Parameter(description = "Jurisdiction id; omit for national positions")
            @RequestParam(value = "jurisdictionId", required = false) String jurisdictionId) {
        return registryService.getCurrent(positionId, jurisdictionType, jurisdictionId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List assignments", description = "Lists assignments in creation order.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Assignments",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            array = @ArraySchema(schema = @Schema(implementation = AssignmentResponse.class))))
    })
    public ResponseEntity<List<AssignmentResponse>> list(
            @Parameter(description = "Only return current holders")
            @RequestParam(value = "currentOnly", defaultValue = "true") boolean currentOnly) {
        return ResponseEntity.ok(registryService.list(currentOnly));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get an assignment by id")
    public ResponseEntity<AssignmentResponse> getById(@PathVariable("id") String id) {
        return ResponseEntity.ok(registryService.getById(id));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Create a current assignment",
            description = "Installs a holder for a vacant position. The politician is matched by name and birth date "
                    + "and registered when unknown."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Assignment created",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = AssignmentResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request or term",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "409", description = "The position already has a current holder",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<AssignmentResponse> create(@Valid @RequestBody CreateAssignmentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registryService.create(request));
    }

    @PutMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Update a current assignment in place",
            description = "Overwrites term dates, party, photo and bio. No history entry is created.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Assignment updated"),
            @ApiResponse(responseCode = "404", description = "Assignment not found"),
            @ApiResponse(responseCode = "409", description = "Assignment is archived")
    })
    public ResponseEntity<AssignmentResponse> update(@PathVariable("id") String id,
                                                     @Valid @RequestBody UpdateAssignmentRequest request) {
        return ResponseEntity.ok(registryService.update(id, request));
    }

    @PostMapping(value = "/{id}/close", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Close a current assignment")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Assignment closed"),
            @ApiResponse(responseCode = "404", description = "Assignment not found"),
            @ApiResponse(responseCode = "409", description = "Assignment already closed")
    })
    public ResponseEntity<AssignmentResponse> close(@PathVariable("id") String id,
                                                    @RequestBody(required = false) CloseAssignmentRequest request) {
        return ResponseEntity.ok(registryService.close(id, request));
    }

    @PostMapping(value = "/replace", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Replace the current holder",
            description = """
                    Archives `expectedCurrentId` and creates the successor as the current holder in one step.
                    
                    If `expectedCurrentId` is no longer current, **409** is returned and nothing changes.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Successor installed",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = AssignmentResponse.class))),
            @ApiResponse(responseCode = "404", description = "Expected holder not found"),
            @ApiResponse(responseCode = "409", description = "Expected holder is no longer current")
    })
    public ResponseEntity<AssignmentResponse> replace(@Valid @RequestBody ReplaceAssignmentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registryService.replace(request));
    }
}
