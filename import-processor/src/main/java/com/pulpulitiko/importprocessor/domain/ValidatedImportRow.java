package com.pulpulitiko.importprocessor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * An {@link ImportRow} resolved against the reference catalog.
 *
 * <p>Rows with errors are never filtered out of the chunk; {@link #isValid()} is {@code false}
 * and {@link #getErrors()} lists every problem so the writer can separate them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidatedImportRow {

    private int rowNumber;

    private String politicianName;

    private String positionId;

    /** Catalog spelling of the position, kept for reports. */
    private String positionName;

    /** Nullable: independents have no party. */
    private String partyId;

    private String partyName;

    private JurisdictionRef jurisdiction;

    /** Jurisdiction name as typed, kept for reports. */
    private String jurisdictionName;

    private LocalDate termStart;

    private LocalDate termEnd;

    private LocalDate birthDate;

    private String photoUrl;

    private String shortBio;

    // ── Validation result fields (populated by ImportRowValidator) ───────────

    @Builder.Default
    private boolean valid = true;

    @Builder.Default
    private List<ValidationError> errors = new ArrayList<>();

    public AssignmentKey key() {
        return new AssignmentKey(positionId, jurisdiction);
    }
}
