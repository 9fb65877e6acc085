package com.pulpulitiko.importprocessor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * An assignment as held by the officeholder registry.
 *
 * <p>Before creation {@code id} and {@code politicianId} are {@code null}; the registry assigns both.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OfficeholderAssignment {

    private String id;

    private String politicianId;

    private String politicianName;

    private LocalDate politicianBirthDate;

    private String positionId;

    private String partyId;

    private JurisdictionRef jurisdiction;

    private LocalDate termStart;

    /** Open while {@code null}. */
    private LocalDate termEnd;

    private String photoUrl;

    private String shortBio;

    private boolean current;

    /** Set when the assignment is closed, e.g. {@code replaced}. */
    private String endedReason;

    public AssignmentKey key() {
        return new AssignmentKey(positionId, jurisdiction);
    }
}
