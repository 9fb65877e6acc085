package com.pulpulitiko.importprocessor.spreadsheet;

import java.util.List;

/**
 * Column headers of the officeholder import sheet, in normalized (trimmed, lower-case) form.
 */
public final class ImportColumns {

    public static final String NAME = "name";
    public static final String POSITION = "position";
    public static final String JURISDICTION_TYPE = "jurisdiction type";
    public static final String JURISDICTION_NAME = "jurisdiction name";
    public static final String PARTY = "party";
    public static final String TERM_START = "term start";
    public static final String TERM_END = "term end";
    public static final String PHOTO_URL = "photo url";
    public static final String SHORT_BIO = "short bio";
    public static final String BIRTH_DATE = "birth date";

    public static final List<String> REQUIRED = List.of(
            NAME, POSITION, JURISDICTION_TYPE, JURISDICTION_NAME, PARTY, TERM_START);

    /** Header row written by the registry export; reads back through the same reader. */
    public static final List<String> EXPORT_HEADERS = List.of(
            "Name", "Position", "Jurisdiction Type", "Jurisdiction Name", "Party",
            "Term Start", "Term End", "Photo URL", "Short Bio");

    /** Header row of the blank import template. */
    public static final List<String> TEMPLATE_HEADERS = List.of(
            "Name", "Position", "Jurisdiction Type", "Jurisdiction Name", "Party",
            "Term Start", "Term End", "Photo URL", "Short Bio", "Birth Date");

    private ImportColumns() {
    }
}
