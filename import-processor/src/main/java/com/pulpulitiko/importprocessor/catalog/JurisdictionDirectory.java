package com.pulpulitiko.importprocessor.catalog;

import com.pulpulitiko.importprocessor.domain.JurisdictionRef;
import com.pulpulitiko.importprocessor.domain.JurisdictionType;

/**
 * Resolves jurisdictions by name. Matching is exact and case-insensitive; there is no fuzzy lookup.
 */
public interface JurisdictionDirectory {

    /**
     * @throws JurisdictionNotFoundException when no jurisdiction of that type has the name
     * @throws ReferenceDataException        when the directory cannot be reached
     */
    JurisdictionRef lookup(JurisdictionType type, String name);

    /**
     * Reverse lookup used by the registry export.
     *
     * @throws JurisdictionNotFoundException when the id is unknown
     * @throws ReferenceDataException        when the directory cannot be reached
     */
    String nameOf(JurisdictionRef ref);
}
