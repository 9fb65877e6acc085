package com.pulpulitiko.importprocessor.validation;

import com.pulpulitiko.importprocessor.catalog.JurisdictionNotFoundException;
import com.pulpulitiko.importprocessor.catalog.Party;
import com.pulpulitiko.importprocessor.catalog.Position;
import com.pulpulitiko.importprocessor.catalog.ReferenceCatalog;
import com.pulpulitiko.importprocessor.catalog.ReferenceDataException;
import com.pulpulitiko.importprocessor.config.ImportProperties;
import com.pulpulitiko.importprocessor.domain.ImportRow;
import com.pulpulitiko.importprocessor.domain.JurisdictionType;
import com.pulpulitiko.importprocessor.domain.ValidatedImportRow;
import com.pulpulitiko.importprocessor.domain.ValidationError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates one {@link ImportRow} against a {@link ReferenceCatalog} snapshot.
 *
 * <h3>Field order</h3>
 * <ol>
 *   <li>name: required</li>
 *   <li>position: required, exact catalog match, suggestions on a miss</li>
 *   <li>jurisdiction type: one of the six types; non-national types resolve the jurisdiction name</li>
 *   <li>party: required unless configured otherwise, exact catalog match, suggestions on a miss</li>
 *   <li>term start: required {@code YYYY-MM-DD}</li>
 *   <li>term end: optional {@code YYYY-MM-DD}, not before term start</li>
 *   <li>birth date: optional {@code YYYY-MM-DD}</li>
 * </ol>
 * Every field is checked even after an earlier one fails, so one pass reports all of a row's
 * problems. Nothing is thrown; a failing jurisdiction lookup becomes an error on the row.
 */
@Slf4j
@Component
public class ImportRowValidator {

    static final String FIELD_NAME = "name";
    static final String FIELD_POSITION = "position";
    static final String FIELD_JURISDICTION_TYPE = "jurisdiction_type";
    static final String FIELD_JURISDICTION_NAME = "jurisdiction_name";
    static final String FIELD_PARTY = "party";
    static final String FIELD_TERM_START = "term_start";
    static final String FIELD_TERM_END = "term_end";
    static final String FIELD_BIRTH_DATE = "birth_date";

    private static final DateTimeFormatter ISO_DATE =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private final SuggestionEngine suggestionEngine;
    private final int suggestionLimit;
    private final boolean partyRequired;

    @Autowired
    public ImportRowValidator(SuggestionEngine suggestionEngine, ImportProperties importProperties) {
        this(suggestionEngine,
                importProperties.getSuggestions().getLimit(),
                importProperties.getValidation().isPartyRequired());
    }

    public ImportRowValidator(SuggestionEngine suggestionEngine, int suggestionLimit, boolean partyRequired) {
        this.suggestionEngine = suggestionEngine;
        this.suggestionLimit = suggestionLimit;
        this.partyRequired = partyRequired;
    }

    public ValidatedImportRow validate(ImportRow row, ReferenceCatalog catalog) {
        int rowNumber = row.getRowNumber();
        List<ValidationError> errors = new ArrayList<>();
        ValidatedImportRow.ValidatedImportRowBuilder result = ValidatedImportRow.builder()
                .rowNumber(rowNumber)
                .politicianName(trim(row.getName()))
                .jurisdictionName(trim(row.getJurisdictionName()))
                .photoUrl(row.getPhotoUrl())
                .shortBio(row.getShortBio());

        // 1. name
        if (isBlank(row.getName())) {
            errors.add(ValidationError.of(rowNumber, FIELD_NAME, "Name is required", row.getName()));
        }

        // 2. position
        String position = row.getPosition();
        if (isBlank(position)) {
            errors.add(ValidationError.of(rowNumber, FIELD_POSITION, "Position is required", position));
        } else {
            Optional<Position> found = catalog.findPosition(position);
            if (found.isPresent()) {
                result.positionId(found.get().id()).positionName(found.get().name());
            } else {
                errors.add(new ValidationError(rowNumber, FIELD_POSITION,
                        "Position '%s' not found".formatted(position), position,
                        suggestionEngine.suggest(position, catalog.positionNames(), suggestionLimit)));
            }
        }

        // 3. jurisdiction type, then name
        validateJurisdiction(row, catalog, result, errors);

        // 4. party
        String party = row.getParty();
        if (isBlank(party)) {
            if (partyRequired) {
                errors.add(ValidationError.of(rowNumber, FIELD_PARTY, "Party is required", party));
            }
        } else {
            Optional<Party> found = catalog.findParty(party);
            if (found.isPresent()) {
                result.partyId(found.get().id()).partyName(found.get().name());
            } else {
                errors.add(new ValidationError(rowNumber, FIELD_PARTY,
                        "Party '%s' not found".formatted(party), party,
                        suggestionEngine.suggest(party, catalog.partyNames(), suggestionLimit)));
            }
        }

        // 5. term start
        LocalDate termStart = null;
        if (isBlank(row.getTermStart())) {
            errors.add(ValidationError.of(rowNumber, FIELD_TERM_START, "Term start date is required", row.getTermStart()));
        } else {
            termStart = parseDate(rowNumber, FIELD_TERM_START, row.getTermStart(), errors);
            result.termStart(termStart);
        }

        // 6. term end
        if (!isBlank(row.getTermEnd())) {
            LocalDate termEnd = parseDate(rowNumber, FIELD_TERM_END, row.getTermEnd(), errors);
            if (termStart != null && termEnd != null && termEnd.isBefore(termStart)) {
                errors.add(ValidationError.of(rowNumber, FIELD_TERM_END,
                        "Term end must not be before term start", row.getTermEnd()));
            }
            result.termEnd(termEnd);
        }

        // 7. birth date
        if (!isBlank(row.getBirthDate())) {
            result.birthDate(parseDate(rowNumber, FIELD_BIRTH_DATE, row.getBirthDate(), errors));
        }

        ValidatedImportRow validated = result
                .valid(errors.isEmpty())
                .errors(errors)
                .build();
        if (validated.isValid()) {
            log.debug("Row {} VALID", rowNumber);
        } else {
            log.debug("Row {} INVALID with {} error(s)", rowNumber, errors.size());
        }
        return validated;
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private void validateJurisdiction(ImportRow row, ReferenceCatalog catalog,
                                      ValidatedImportRow.ValidatedImportRowBuilder result,
                                      List<ValidationError> errors) {
        int rowNumber = row.getRowNumber();
        String typeText = row.getJurisdictionType();
        if (isBlank(typeText)) {
            errors.add(ValidationError.of(rowNumber, FIELD_JURISDICTION_TYPE, "Jurisdiction type is required", typeText));
            return;
        }
        Optional<JurisdictionType> type = JurisdictionType.fromText(typeText);
        if (type.isEmpty()) {
            errors.add(new ValidationError(rowNumber, FIELD_JURISDICTION_TYPE,
                    "Invalid jurisdiction type '%s'".formatted(typeText), typeText, JurisdictionType.wireValues()));
            return;
        }
        if (type.get() == JurisdictionType.NATIONAL) {
            result.jurisdiction(catalog.lookupJurisdiction(JurisdictionType.NATIONAL, ""));
            return;
        }

        String name = row.getJurisdictionName();
        if (isBlank(name)) {
            errors.add(ValidationError.of(rowNumber, FIELD_JURISDICTION_NAME,
                    "Jurisdiction name is required for non-national positions", name));
            return;
        }
        try {
            result.jurisdiction(catalog.lookupJurisdiction(type.get(), name));
        } catch (JurisdictionNotFoundException e) {
            errors.add(ValidationError.of(rowNumber, FIELD_JURISDICTION_NAME,
                    "Jurisdiction '%s' not found for type '%s'".formatted(name, type.get().wireValue()), name));
        } catch (ReferenceDataException e) {
            log.warn("Jurisdiction lookup failed on row {} for {} '{}': {}",
                    rowNumber, type.get().wireValue(), name, e.getMessage());
            errors.add(ValidationError.of(rowNumber, FIELD_JURISDICTION_NAME,
                    "Jurisdiction lookup failed for '%s': %s".formatted(name, e.getMessage()), name));
        }
    }

    private static LocalDate parseDate(int rowNumber, String field, String value, List<ValidationError> errors) {
        try {
            return LocalDate.parse(value.trim(), ISO_DATE);
        } catch (DateTimeParseException e) {
            errors.add(ValidationError.of(rowNumber, field,
                    "Invalid date format '%s'. Expected YYYY-MM-DD".formatted(value), value));
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
