package com.pulpulitiko.importprocessor.domain;

/**
 * A position within one jurisdiction. At most one assignment per key is current.
 */
public record AssignmentKey(String positionId, JurisdictionRef jurisdiction) {
}
