package com.pulpulitiko.registryservice.domain;

import java.util.Locale;

/**
 * Uniqueness key of a current assignment: a position within one jurisdiction.
 * National positions carry an empty jurisdiction id.
 */
public record AssignmentKey(String positionId, String jurisdictionType, String jurisdictionId) {

    public static AssignmentKey of(String positionId, String jurisdictionType, String jurisdictionId) {
        return new AssignmentKey(
                positionId.trim(),
                jurisdictionType.trim().toLowerCase(Locale.ROOT),
                jurisdictionId == null ? "" : jurisdictionId.trim());
    }
}
