package com.pulpulitiko.registryservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Request payload for installing a new current officeholder.
 * The politician is matched by name and birth date, and registered when unknown.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to create a current assignment")
public class CreateAssignmentRequest {

    @NotBlank(message = "politicianName must not be blank")
    @Schema(description = "Officeholder's full name", example = "Juan dela Cruz", requiredMode = Schema.RequiredMode.REQUIRED)
    private String politicianName;

    @Schema(description = "Birth date, used to tell apart people with the same name", example = "1970-05-14")
    private LocalDate birthDate;

    @NotBlank(message = "positionId must not be blank")
    @Schema(description = "Position id from the reference catalog", requiredMode = Schema.RequiredMode.REQUIRED)
    private String positionId;

    @Schema(description = "Party id from the reference catalog; omitted for independents")
    private String partyId;

    @NotBlank(message = "jurisdictionType must not be blank")
    @Schema(description = "Jurisdiction type", example = "province", requiredMode = Schema.RequiredMode.REQUIRED,
            allowableValues = {"national", "region", "province", "city", "barangay", "district"})
    private String jurisdictionType;

    @Schema(description = "Jurisdiction id; omitted for national positions")
    private String jurisdictionId;

    @NotNull(message = "termStart must not be null")
    @Schema(description = "First day of the term", example = "2022-06-30", requiredMode = Schema.RequiredMode.REQUIRED)
    private LocalDate termStart;

    @Schema(description = "Last day of the term, if known", example = "2025-06-30")
    private LocalDate termEnd;

    private String photoUrl;

    private String shortBio;
}
