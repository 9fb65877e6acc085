package com.pulpulitiko.importprocessor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The fields of a spreadsheet row the import cares about, still as free text.
 *
 * <p>Required columns:
 * <pre>
 *   name, position, jurisdiction type, jurisdiction name, party, term start
 * </pre>
 * Optional columns: term end, photo url, short bio, birth date.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportRow {

    /** 1-based sheet row; row 1 is the header, so data rows start at 2. */
    private int rowNumber;

    private String name;

    /** Position name as typed, matched against the catalog. */
    private String position;

    /** Lower-cased jurisdiction type text; may not be a valid type. */
    private String jurisdictionType;

    /** Blank for national positions. */
    private String jurisdictionName;

    private String party;

    /** Expected as YYYY-MM-DD. */
    private String termStart;

    // ── Optional fields: null when the cell is blank ─────────────────────────

    private String termEnd;

    private String photoUrl;

    private String shortBio;

    private String birthDate;
}
