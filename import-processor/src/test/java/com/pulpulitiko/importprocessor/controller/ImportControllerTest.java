package com.pulpulitiko.importprocessor.controller;

import com.jayway.jsonpath.JsonPath;
import com.pulpulitiko.importprocessor.client.OfficeholderRegistryClient;
import com.pulpulitiko.importprocessor.client.ReferenceCatalogClient;
import com.pulpulitiko.importprocessor.domain.ImportRun;
import com.pulpulitiko.importprocessor.domain.ImportRunStatus;
import com.pulpulitiko.importprocessor.domain.JurisdictionRef;
import com.pulpulitiko.importprocessor.domain.JurisdictionType;
import com.pulpulitiko.importprocessor.domain.OfficeholderAssignment;
import com.pulpulitiko.importprocessor.service.ImportRunService;
import com.pulpulitiko.importprocessor.support.InMemoryOfficeholderRegistry;
import com.pulpulitiko.importprocessor.support.TestCatalogs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.LocalDate;

import static com.pulpulitiko.importprocessor.support.TestWorkbooks.headersWithout;
import static com.pulpulitiko.importprocessor.support.TestWorkbooks.row;
import static com.pulpulitiko.importprocessor.support.TestWorkbooks.xlsx;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ImportControllerTest {

    private static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    @Autowired private MockMvc mockMvc;
    @Autowired private ImportRunService importRunService;

    @MockitoBean private ReferenceCatalogClient referenceCatalogClient;
    @MockitoBean private OfficeholderRegistryClient registryClient;

    private InMemoryOfficeholderRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryOfficeholderRegistry();
        when(referenceCatalogClient.loadCatalog()).thenReturn(TestCatalogs.catalog());
        when(registryClient.getCurrent(any())).thenAnswer(inv -> registry.getCurrent(inv.getArgument(0)));
        when(registryClient.createAssignment(any())).thenAnswer(inv -> registry.createAssignment(inv.getArgument(0)));
        when(registryClient.listCurrent()).thenAnswer(inv -> registry.listCurrent());
    }

    // ─── Upload ──────────────────────────────────────────────────────────────

    @Test
    void uploadIsAcceptedWithRunId() throws Exception {
        MockMultipartFile file = workbook("officials.xlsx",
                xlsx(row("Michael Rama", "Mayor", "city", "Cebu City", "PDP-Laban", "2022-06-30")));

        MvcResult result = mockMvc.perform(multipart("/api/v1/imports").file(file))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.importRunId", notNullValue()))
                .andExpect(jsonPath("$.jobExecutionId", notNullValue()))
                .andExpect(jsonPath("$.filename").value("officials.xlsx"))
                .andReturn();

        String runId = JsonPath.read(result.getResponse().getContentAsString(), "$.importRunId");
        ImportRun finished = awaitFinished(runId);
        assertThat(finished.getStatus()).isEqualTo(ImportRunStatus.COMPLETED);
        assertThat(finished.getAssignmentsCreated()).isEqualTo(1);
    }

    @Test
    void emptyUploadIsRejected() throws Exception {
        mockMvc.perform(multipart("/api/v1/imports").file(workbook("empty.xlsx", new byte[0])))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("FILE_REQUIRED"));
    }

    @Test
    void uploadWithoutFilePartIsRejected() throws Exception {
        mockMvc.perform(multipart("/api/v1/imports"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("FILE_REQUIRED"));
    }

    // ─── Validate (dry run) ──────────────────────────────────────────────────

    @Test
    void validateReportsRowErrorsWithoutWriting() throws Exception {
        MockMultipartFile file = workbook("officials.xlsx", xlsx(
                row("Michael Rama", "Mayor", "city", "Cebu City", "PDP-Laban", "2022-06-30"),
                row("Gwendolyn Garcia", "Govenor", "province", "Cebu", "One Cebu", "2019-06-30")));

        mockMvc.perform(multipart("/api/v1/imports/validate").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRows").value(2))
                .andExpect(jsonPath("$.validRows").value(1))
                .andExpect(jsonPath("$.invalidRows").value(1))
                .andExpect(jsonPath("$.errors[0].row").value(3))
                .andExpect(jsonPath("$.errors[0].field").value("position"))
                .andExpect(jsonPath("$.errors[0].suggestions[0]").value("Governor"));

        assertThat(registry.writeCount()).isZero();
    }

    @Test
    void validateRejectsStructurallyBrokenWorkbook() throws Exception {
        MockMultipartFile file = workbook("officials.xlsx", xlsx(headersWithout("Party"),
                row("Michael Rama", "Mayor", "city", "Cebu City", "2022-06-30")));

        mockMvc.perform(multipart("/api/v1/imports/validate").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_COLUMN"))
                .andExpect(jsonPath("$.message").value("Missing required column: party"));
    }

    @Test
    void validateRejectsNonSpreadsheet() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "officials.csv", "text/csv",
                "name,position\nMichael Rama,Mayor\n".getBytes());

        mockMvc.perform(multipart("/api/v1/imports/validate").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_INPUT"));
    }

    // ─── Runs and reports ────────────────────────────────────────────────────

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/imports/{id}", "no-such-run"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("IMPORT_RUN_NOT_FOUND"));
    }

    @Test
    void pendingRunIsListedAndHasNoReportYet() throws Exception {
        ImportRun run = importRunService.create("pending.xlsx");

        mockMvc.perform(get("/api/v1/imports/{id}", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.filename").value("pending.xlsx"));

        mockMvc.perform(get("/api/v1/imports/{id}/error-report", run.getId()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("REPORT_NOT_AVAILABLE"));
    }

    @Test
    void runListIsPagedNewestFirst() throws Exception {
        importRunService.create("older.xlsx");
        ImportRun newest = importRunService.create("newest.xlsx");

        mockMvc.perform(get("/api/v1/imports").param("page", "1").param("perPage", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.importRuns.length()").value(1))
                .andExpect(jsonPath("$.importRuns[0].id").value(newest.getId()))
                .andExpect(jsonPath("$.page").value(1))
                .andExpect(jsonPath("$.perPage").value(1))
                .andExpect(jsonPath("$.total").value(importRunService.list(1, 1).total()));
    }

    @Test
    void runListFallsBackToDefaultPaging() throws Exception {
        mockMvc.perform(get("/api/v1/imports").param("page", "0").param("perPage", "500"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.page").value(1))
                .andExpect(jsonPath("$.perPage").value(20));
    }

    @Test
    void errorReportOfUnknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/imports/{id}/error-report", "no-such-run"))
                .andExpect(status().isNotFound());
    }

    @Test
    void completedRunHasDownloadableErrorReport() throws Exception {
        ImportRun run = importRunService.create("done.xlsx");
        importRunService.markCompleted(run.getId());

        mockMvc.perform(get("/api/v1/imports/{id}/error-report", run.getId()))
                .andExpect(status().isOk())
                .andExpect(content().contentType(XLSX))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("import_errors_" + run.getId() + ".xlsx")));
    }

    @Test
    void templateIsDownloadable() throws Exception {
        mockMvc.perform(get("/api/v1/imports/template"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(XLSX))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("politician_import_template.xlsx")));
    }

    @Test
    void exportListsCurrentOfficeholders() throws Exception {
        registry.seed(OfficeholderAssignment.builder()
                .politicianName("Michael Rama")
                .positionId("pos-mayor")
                .partyId("party-pdp")
                .jurisdiction(JurisdictionRef.of(JurisdictionType.CITY, "city-cebu"))
                .termStart(LocalDate.of(2022, 6, 30))
                .current(true)
                .build());

        mockMvc.perform(get("/api/v1/officeholders/export"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(XLSX))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("officeholders_")));
    }

    // ─── helpers ─────────────────────────────────────────────────────────────

    /** The upload runs on the async launcher; wait for it so no job outlives the test's mocks. */
    private ImportRun awaitFinished(String runId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            ImportRun run = importRunService.find(runId).orElseThrow();
            if (run.getStatus() == ImportRunStatus.COMPLETED || run.getStatus() == ImportRunStatus.FAILED) {
                return run;
            }
            Thread.sleep(50);
        }
        throw new AssertionError("Import run " + runId + " did not finish in time");
    }

    private static MockMultipartFile workbook(String filename, byte[] content) {
        return new MockMultipartFile("file", filename, XLSX, content);
    }
}
