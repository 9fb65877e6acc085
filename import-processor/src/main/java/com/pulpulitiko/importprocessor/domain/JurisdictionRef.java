package com.pulpulitiko.importprocessor.domain;

import java.util.Objects;

/**
 * A resolved jurisdiction: exactly one region, province, city, barangay or district id,
 * or the national marker (type {@link JurisdictionType#NATIONAL}, no id).
 */
public record JurisdictionRef(JurisdictionType type, String id) {

    public JurisdictionRef {
        Objects.requireNonNull(type, "type");
        if (type == JurisdictionType.NATIONAL) {
            id = null;
        } else if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("A " + type.wireValue() + " jurisdiction needs an id");
        }
    }

    public static JurisdictionRef national() {
        return new JurisdictionRef(JurisdictionType.NATIONAL, null);
    }

    public static JurisdictionRef of(JurisdictionType type, String id) {
        return new JurisdictionRef(type, id);
    }

    public boolean isNational() {
        return type == JurisdictionType.NATIONAL;
    }
}
