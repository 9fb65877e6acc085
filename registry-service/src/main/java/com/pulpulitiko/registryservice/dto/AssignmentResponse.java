package com.pulpulitiko.registryservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;

/**
 * Response payload for one officeholder assignment.
 */
@Getter
@Builder
@Schema(description = "An officeholder assignment, current or archived")
public class AssignmentResponse {

    private final String id;

    private final String politicianId;

    @Schema(example = "Juan dela Cruz")
    private final String politicianName;

    private final LocalDate politicianBirthDate;

    private final String positionId;

    private final String partyId;

    @Schema(example = "province")
    private final String jurisdictionType;

    @Schema(description = "Empty for national positions")
    private final String jurisdictionId;

    private final LocalDate termStart;

    private final LocalDate termEnd;

    private final String photoUrl;

    private final String shortBio;

    @Schema(description = "Whether this is the current holder of the position")
    private final boolean current;

    @Schema(example = "replaced")
    private final String endedReason;
}
