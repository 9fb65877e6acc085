package com.pulpulitiko.importprocessor.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Scope a position applies to. The wire value is the lower-case name.
 */
public enum JurisdictionType {

    NATIONAL,
    REGION,
    PROVINCE,
    CITY,
    BARANGAY,
    DISTRICT;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a spreadsheet value, ignoring case and surrounding whitespace.
     */
    public static Optional<JurisdictionType> fromText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.wireValue().equals(normalized))
                .findFirst();
    }

    public static List<String> wireValues() {
        return Arrays.stream(values()).map(JurisdictionType::wireValue).toList();
    }
}
