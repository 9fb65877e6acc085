package com.pulpulitiko.importprocessor.spreadsheet;

import com.pulpulitiko.importprocessor.domain.ImportRow;
import com.pulpulitiko.importprocessor.domain.RawRow;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Maps a {@link RawRow} to an {@link ImportRow}.
 *
 * <p>Required fields stay empty strings when blank so the validator can report them;
 * optional fields become {@code null}.
 */
@Component
public class ImportRowMapper {

    public ImportRow map(RawRow raw) {
        return ImportRow.builder()
                .rowNumber(raw.rowNumber())
                .name(raw.get(ImportColumns.NAME))
                .position(raw.get(ImportColumns.POSITION))
                .jurisdictionType(raw.get(ImportColumns.JURISDICTION_TYPE).toLowerCase(Locale.ROOT))
                .jurisdictionName(raw.get(ImportColumns.JURISDICTION_NAME))
                .party(raw.get(ImportColumns.PARTY))
                .termStart(raw.get(ImportColumns.TERM_START))
                .termEnd(optional(raw, ImportColumns.TERM_END))
                .photoUrl(optional(raw, ImportColumns.PHOTO_URL))
                .shortBio(optional(raw, ImportColumns.SHORT_BIO))
                .birthDate(optional(raw, ImportColumns.BIRTH_DATE))
                .build();
    }

    private static String optional(RawRow raw, String header) {
        String value = raw.get(header);
        return value.isEmpty() ? null : value;
    }
}
