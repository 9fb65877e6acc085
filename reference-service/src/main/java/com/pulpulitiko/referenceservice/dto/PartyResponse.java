package com.pulpulitiko.referenceservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

/**
 * Response payload for a single political party.
 */
@Getter
@Builder
@Schema(description = "A registered political party")
public class PartyResponse {

    @Schema(description = "Party id")
    private final String id;

    @Schema(description = "Full party name", example = "Partido Demokratiko Pilipino")
    private final String name;

    @Schema(description = "Short name", example = "PDP")
    private final String abbreviation;
}
