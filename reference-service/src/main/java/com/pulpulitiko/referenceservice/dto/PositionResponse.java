package com.pulpulitiko.referenceservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

/**
 * Response payload for a single position entry.
 */
@Getter
@Builder
@Schema(description = "A position an officeholder can be assigned to")
public class PositionResponse {

    @Schema(description = "Position id", example = "2b1e5c57-8d41-3b5e-9c0a-6f1d2c3b4a59")
    private final String id;

    @Schema(description = "Position name as written in import files", example = "Governor")
    private final String name;

    @Schema(description = "Jurisdiction level of the position", example = "province")
    private final String level;

    @Schema(description = "Government branch", example = "executive")
    private final String branch;
}
