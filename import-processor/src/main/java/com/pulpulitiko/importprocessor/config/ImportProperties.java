package com.pulpulitiko.importprocessor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Binds the {@code importer} section from application.yml. Out-of-range values stop the
 * application at startup.
 */
@Getter
@Setter
@Component
@Validated
@ConfigurationProperties(prefix = "importer")
public class ImportProperties {

    /** Directory uploaded spreadsheets are stored in until the batch job reads them. */
    @NotBlank
    private String uploadDir = System.getProperty("java.io.tmpdir") + "/officeholder-imports";

    @Valid
    private Suggestions suggestions = new Suggestions();

    @Valid
    private Validation validation = new Validation();

    @Getter
    @Setter
    public static class Suggestions {
        /** Maximum suggestions reported per unmatched position or party. */
        @Min(1)
        @Max(3)
        private int limit = 3;
        /**
         * Largest edit distance still offered as a suggestion when no name contains the other.
         * {@code 0} keeps suggestions to containment and prefix matches only.
         */
        @Min(0)
        private int maxEditDistance = 2;
    }

    @Getter
    @Setter
    public static class Validation {
        /**
         * Whether a blank party is an error. When {@code false} a blank party imports
         * as an independent (no party id); an unknown party name is still an error.
         */
        private boolean partyRequired = true;
    }
}
