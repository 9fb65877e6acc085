package com.pulpulitiko.registryservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Overwrites the mutable fields of a current assignment. Absent fields are cleared.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to update a current assignment in place")
public class UpdateAssignmentRequest {

    private String partyId;

    @NotNull(message = "termStart must not be null")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED)
    private LocalDate termStart;

    private LocalDate termEnd;

    private String photoUrl;

    private String shortBio;
}
