package com.pulpulitiko.referenceservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code reference-data} section from application.yml.
 * Holds the canonical positions, parties and jurisdictions that imports are validated against.
 */
@Getter
@Setter
@Component
@Validated
@ConfigurationProperties(prefix = "reference-data")
public class ReferenceDataProperties {

    @Valid
    private List<PositionEntry> positions = new ArrayList<>();

    @Valid
    private List<PartyEntry> parties = new ArrayList<>();

    @Valid
    private List<JurisdictionEntry> jurisdictions = new ArrayList<>();

    @Getter
    @Setter
    public static class PositionEntry {
        /** Stable id; derived from the name when omitted. */
        private String id;
        /** Display name matched by imports, e.g. "Governor". */
        @NotBlank
        private String name;
        /** Jurisdiction level the position belongs to, e.g. "province". */
        private String level;
        /** Government branch: executive, legislative or judicial. */
        private String branch;
    }

    @Getter
    @Setter
    public static class PartyEntry {
        private String id;
        @NotBlank
        private String name;
        private String abbreviation;
    }

    @Getter
    @Setter
    public static class JurisdictionEntry {
        private String id;
        /** One of region, province, city, barangay, district. */
        @NotBlank
        @Pattern(regexp = "(?i)\\s*(region|province|city|barangay|district)\\s*")
        private String type;
        @NotBlank
        private String name;
    }
}
