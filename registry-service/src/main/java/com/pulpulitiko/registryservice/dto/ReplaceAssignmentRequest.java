package com.pulpulitiko.registryservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Archive-then-create in one call.
 *
 * <p>The registry closes {@code expectedCurrentId} and creates {@code assignment} under a single
 * lock. If {@code expectedCurrentId} is no longer the current holder of the key the request is
 * rejected and nothing changes.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to replace the current holder of a position")
public class ReplaceAssignmentRequest {

    @NotBlank(message = "expectedCurrentId must not be blank")
    @Schema(description = "Id of the assignment the caller believes is current", requiredMode = Schema.RequiredMode.REQUIRED)
    private String expectedCurrentId;

    @Schema(description = "Term end to record on the archived assignment; keeps its own when omitted")
    private LocalDate closeTermEnd;

    @Schema(description = "Ended reason for the archived assignment", example = "replaced")
    private String endedReason;

    @Valid
    @NotNull(message = "assignment must not be null")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED)
    private CreateAssignmentRequest assignment;
}
