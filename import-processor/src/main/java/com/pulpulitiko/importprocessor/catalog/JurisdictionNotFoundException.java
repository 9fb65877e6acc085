package com.pulpulitiko.importprocessor.catalog;

import com.pulpulitiko.importprocessor.domain.JurisdictionType;
import lombok.Getter;

@Getter
public class JurisdictionNotFoundException extends RuntimeException {

    private final JurisdictionType type;
    private final String name;

    public JurisdictionNotFoundException(JurisdictionType type, String name) {
        super("Jurisdiction '%s' not found for type '%s'".formatted(name, type.wireValue()));
        this.type = type;
        this.name = name;
    }
}
