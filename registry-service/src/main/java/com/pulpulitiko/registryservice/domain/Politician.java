package com.pulpulitiko.registryservice.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.Locale;

/**
 * A person known to the registry.
 *
 * <p>Two politicians are the same person when their normalized names are equal and their
 * birth dates do not contradict each other (equal, or unknown on either side).
 */
@Getter
@AllArgsConstructor
public class Politician {

    private final String id;

    private final String name;

    @Setter
    private LocalDate birthDate;

    public boolean isSamePerson(String otherName, LocalDate otherBirthDate) {
        if (!normalize(name).equals(normalize(otherName))) {
            return false;
        }
        return birthDate == null || otherBirthDate == null || birthDate.equals(otherBirthDate);
    }

    /** Trims, collapses inner whitespace and case-folds a person's name. */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
