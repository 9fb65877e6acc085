package com.pulpulitiko.referenceservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

/**
 * Response payload for a resolved jurisdiction.
 */
@Getter
@Builder
@Schema(description = "A region, province, city, barangay or district")
public class JurisdictionResponse {

    @Schema(description = "Jurisdiction id")
    private final String id;

    @Schema(description = "Jurisdiction type", example = "province",
            allowableValues = {"region", "province", "city", "barangay", "district"})
    private final String type;

    @Schema(description = "Jurisdiction name", example = "Cebu")
    private final String name;
}
