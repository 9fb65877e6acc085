package com.pulpulitiko.importprocessor.validation;

import com.pulpulitiko.importprocessor.catalog.ReferenceCatalog;
import com.pulpulitiko.importprocessor.domain.ImportRow;
import com.pulpulitiko.importprocessor.domain.JurisdictionRef;
import com.pulpulitiko.importprocessor.domain.JurisdictionType;
import com.pulpulitiko.importprocessor.domain.ValidatedImportRow;
import com.pulpulitiko.importprocessor.domain.ValidationError;
import com.pulpulitiko.importprocessor.support.TestCatalogs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ImportRowValidatorTest {

    private final ReferenceCatalog catalog = TestCatalogs.catalog();
    private final ImportRowValidator validator =
            new ImportRowValidator(new ProximitySuggestionEngine(2), 3, true);

    @Test
    @DisplayName("A complete row resolves every reference")
    void validRow_resolvesIds() {
        ValidatedImportRow result = validator.validate(mayorRow().build(), catalog);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getPositionId()).isEqualTo("pos-mayor");
        assertThat(result.getPartyId()).isEqualTo("party-pdp");
        assertThat(result.getJurisdiction()).isEqualTo(JurisdictionRef.of(JurisdictionType.CITY, "city-cebu"));
        assertThat(result.getTermStart()).isEqualTo(LocalDate.of(2022, 6, 30));
        assertThat(result.getTermEnd()).isEqualTo(LocalDate.of(2025, 6, 30));
    }

    @Test
    @DisplayName("Catalog and jurisdiction names match case-insensitively")
    void lookups_ignoreCase() {
        ImportRow row = mayorRow().position("MAYOR").party("pdp-laban").jurisdictionName("cebu city").build();

        ValidatedImportRow result = validator.validate(row, catalog);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getPositionName()).isEqualTo("Mayor");
        assertThat(result.getPartyName()).isEqualTo("PDP-Laban");
    }

    @Test
    @DisplayName("Term end before term start: exactly one error, on term_end")
    void termEndBeforeStart_singleError() {
        ImportRow row = mayorRow().termStart("2022-06-30").termEnd("2022-06-29").build();

        ValidatedImportRow result = validator.validate(row, catalog);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.field()).isEqualTo("term_end");
            assertThat(error.message()).isEqualTo("Term end must not be before term start");
            assertThat(error.value()).isEqualTo("2022-06-29");
        });
    }

    @Test
    @DisplayName("Term end equal to term start is accepted")
    void termEndEqualsStart_isValid() {
        ImportRow row = mayorRow().termStart("2022-06-30").termEnd("2022-06-30").build();

        assertThat(validator.validate(row, catalog).isValid()).isTrue();
    }

    @Test
    @DisplayName("Misspelt position 'Govenor' suggests 'Governor'")
    void unknownPosition_isSuggested() {
        ImportRow row = ImportRow.builder()
                .rowNumber(4)
                .name("Gwendolyn Garcia")
                .position("Govenor")
                .jurisdictionType("province")
                .jurisdictionName("Cebu")
                .party("One Cebu")
                .termStart("2019-06-30")
                .build();

        ValidatedImportRow result = validator.validate(row, catalog);

        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.row()).isEqualTo(4);
            assertThat(error.field()).isEqualTo("position");
            assertThat(error.message()).isEqualTo("Position 'Govenor' not found");
            assertThat(error.suggestions()).contains("Governor").hasSizeLessThanOrEqualTo(3);
        });
    }

    @Test
    @DisplayName("Unknown party is reported with suggestions")
    void unknownParty_isSuggested() {
        ImportRow row = mayorRow().party("Liberal").build();

        ValidatedImportRow result = validator.validate(row, catalog);

        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.field()).isEqualTo("party");
            assertThat(error.message()).isEqualTo("Party 'Liberal' not found");
            assertThat(error.suggestions()).containsExactly("Liberal Party");
        });
    }

    @Test
    @DisplayName("National position needs no jurisdiction name")
    void national_withoutName_isValid() {
        ImportRow row = ImportRow.builder()
                .rowNumber(2)
                .name("Ferdinand Marcos Jr.")
                .position("President")
                .jurisdictionType("national")
                .jurisdictionName("")
                .party("Nacionalista Party")
                .termStart("2022-06-30")
                .build();

        ValidatedImportRow result = validator.validate(row, catalog);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getJurisdiction().isNational()).isTrue();
        assertThat(result.getJurisdiction().id()).isNull();
    }

    @Test
    @DisplayName("Non-national position without a jurisdiction name is an error")
    void city_withoutName_isInvalid() {
        ValidatedImportRow result = validator.validate(mayorRow().jurisdictionName("").build(), catalog);

        assertThat(result.getErrors()).extracting(ValidationError::field, ValidationError::message)
                .containsExactly(tuple("jurisdiction_name",
                        "Jurisdiction name is required for non-national positions"));
    }

    @Test
    @DisplayName("Unknown jurisdiction name is reported with its type")
    void unknownJurisdiction() {
        ValidatedImportRow result = validator.validate(mayorRow().jurisdictionName("Atlantis").build(), catalog);

        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.field()).isEqualTo("jurisdiction_name");
            assertThat(error.message()).isEqualTo("Jurisdiction 'Atlantis' not found for type 'city'");
        });
    }

    @Test
    @DisplayName("A failing jurisdiction lookup becomes a row error instead of an exception")
    void lookupFailure_isRowError() {
        ReferenceCatalog flaky = TestCatalogs.catalog(TestCatalogs.directory().failOn("Cebu City"));

        ValidatedImportRow result = validator.validate(mayorRow().build(), flaky);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.field()).isEqualTo("jurisdiction_name");
            assertThat(error.message()).isEqualTo("Jurisdiction lookup failed for 'Cebu City': reference-service unavailable");
        });
    }

    @Test
    @DisplayName("Every failing field of a row is reported in one pass")
    void multipleErrors_areAllReported() {
        ImportRow row = ImportRow.builder()
                .rowNumber(7)
                .name(" ")
                .position("")
                .jurisdictionType("town")
                .jurisdictionName("Cebu City")
                .party("")
                .termStart("2022/06/30")
                .build();

        ValidatedImportRow result = validator.validate(row, catalog);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).extracting(ValidationError::field)
                .containsExactly("name", "position", "jurisdiction_type", "party", "term_start");
        assertThat(result.getErrors()).allSatisfy(error -> assertThat(error.row()).isEqualTo(7));
        assertThat(result.getErrors().get(2).message()).isEqualTo("Invalid jurisdiction type 'town'");
        assertThat(result.getErrors().get(2).suggestions())
                .containsExactly("national", "region", "province", "city", "barangay", "district");
        assertThat(result.getErrors().get(4).message()).isEqualTo("Invalid date format '2022/06/30'. Expected YYYY-MM-DD");
    }

    @Test
    @DisplayName("Missing term start is required, not a format error")
    void missingTermStart() {
        ValidatedImportRow result = validator.validate(mayorRow().termStart("").termEnd(null).build(), catalog);

        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.field()).isEqualTo("term_start");
            assertThat(error.message()).isEqualTo("Term start date is required");
        });
    }

    @Test
    @DisplayName("Dates are strict: impossible calendar dates are rejected")
    void impossibleDate_isRejected() {
        ValidatedImportRow result = validator.validate(mayorRow().termEnd("2023-02-30").birthDate("1949-13-01").build(), catalog);

        assertThat(result.getErrors()).extracting(ValidationError::field).containsExactly("term_end", "birth_date");
        assertThat(result.getErrors().get(0).message()).isEqualTo("Invalid date format '2023-02-30'. Expected YYYY-MM-DD");
    }

    @Test
    @DisplayName("With party optional, a blank party imports without one; an unknown party still fails")
    void partyOptional() {
        ImportRowValidator lenient = new ImportRowValidator(new ProximitySuggestionEngine(2), 3, false);

        ValidatedImportRow blank = lenient.validate(mayorRow().party("").build(), catalog);
        ValidatedImportRow unknown = lenient.validate(mayorRow().party("Partido Federal").build(), catalog);

        assertThat(blank.isValid()).isTrue();
        assertThat(blank.getPartyId()).isNull();
        assertThat(unknown.isValid()).isFalse();
        assertThat(unknown.getErrors()).extracting(ValidationError::field).containsExactly("party");
    }

    @Test
    @DisplayName("With party required, a blank party is an error")
    void partyRequired() {
        ValidatedImportRow result = validator.validate(mayorRow().party(null).build(), catalog);

        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.field()).isEqualTo("party");
            assertThat(error.message()).isEqualTo("Party is required");
            assertThat(error.value()).isEmpty();
        });
    }

    // ─── helpers ─────────────────────────────────────────────────────────────

    private static ImportRow.ImportRowBuilder mayorRow() {
        return ImportRow.builder()
                .rowNumber(2)
                .name("Michael Rama")
                .position("Mayor")
                .jurisdictionType("city")
                .jurisdictionName("Cebu City")
                .party("PDP-Laban")
                .termStart("2022-06-30")
                .termEnd("2025-06-30");
    }
}
