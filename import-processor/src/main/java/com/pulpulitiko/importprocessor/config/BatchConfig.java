package com.pulpulitiko.importprocessor.config;

import com.pulpulitiko.importprocessor.batch.ImportRowItemProcessor;
import com.pulpulitiko.importprocessor.batch.ImportRunListener;
import com.pulpulitiko.importprocessor.batch.ReconciliationItemWriter;
import com.pulpulitiko.importprocessor.batch.SpreadsheetItemReader;
import com.pulpulitiko.importprocessor.catalog.ReferenceCatalogLoader;
import com.pulpulitiko.importprocessor.domain.RawRow;
import com.pulpulitiko.importprocessor.domain.ValidatedImportRow;
import com.pulpulitiko.importprocessor.reconcile.OfficeholderRegistry;
import com.pulpulitiko.importprocessor.service.ImportRunService;
import com.pulpulitiko.importprocessor.spreadsheet.ImportRowMapper;
import com.pulpulitiko.importprocessor.spreadsheet.SpreadsheetReader;
import com.pulpulitiko.importprocessor.validation.ImportRowValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.launch.support.TaskExecutorJobLauncher;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Central Spring Batch configuration.
 *
 * <h3>Architecture</h3>
 * <pre>
 *  officeholderImportJob ─► importStep (chunk-oriented, single-threaded, file order)
 *                               │
 *                               ├── SpreadsheetItemReader    (parses the upload, structural checks)
 *                               ├── ImportRowItemProcessor   (maps + validates against the catalog)
 *                               └── ReconciliationItemWriter (registry writes / error collection)
 *
 *  ImportRunListener ─► import run PROCESSING → COMPLETED | FAILED
 * </pre>
 *
 * <p>Rows are reconciled in file order so that a later row for the same position and
 * jurisdiction wins; the step is therefore neither partitioned nor multi-threaded. Separate
 * imports still run concurrently, each on its own launcher thread.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class BatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final ResourceLoader resourceLoader;
    private final ImportRunListener importRunListener;

    @Value("${batch.chunk-size:50}")
    private int chunkSize;

    // ─── Job ─────────────────────────────────────────────────────────────────

    @Bean
    public Job officeholderImportJob() {
        return new JobBuilder("officeholderImportJob", jobRepository)
                .listener(importRunListener)
                .start(importStep())
                .build();
    }

    // ─── Async JobLauncher ────────────────────────────────────────────────────

    /**
     * An async {@link JobLauncher}: {@code run(...)} returns immediately with
     * {@code BatchStatus.STARTING} and the import runs on its own thread.
     * Callers poll {@code GET /api/v1/imports/{id}} to track progress.
     */
    @Bean("asyncJobLauncher")
    @Primary
    public JobLauncher asyncJobLauncher() throws Exception {
        TaskExecutorJobLauncher launcher = new TaskExecutorJobLauncher();
        launcher.setJobRepository(jobRepository);
        launcher.setTaskExecutor(new SimpleAsyncTaskExecutor("import-launcher-"));
        launcher.afterPropertiesSet();
        return launcher;
    }

    // ─── Step (chunk-oriented) ───────────────────────────────────────────────

    @Bean
    public Step importStep() {
        return new StepBuilder("importStep", jobRepository)
                .<RawRow, ValidatedImportRow>chunk(chunkSize, transactionManager)
                .reader(spreadsheetItemReader(null, null, null, null))   // placeholders, resolved by @StepScope
                .processor(importRowItemProcessor(null, null, null))
                .writer(reconciliationItemWriter(null, null, null))
                .build();
    }

    /**
     * Step-scoped reader over the file named by the {@code inputFile} job parameter.
     */
    @Bean
    @StepScope
    public SpreadsheetItemReader spreadsheetItemReader(
            SpreadsheetReader spreadsheetReader,
            ImportRunService importRunService,
            @Value("#{jobParameters['inputFile']}") String inputFile,
            @Value("#{jobParameters['importRunId']}") String importRunId) {
        log.debug("spreadsheetItemReader: file={}, importRunId={}", inputFile, importRunId);
        return new SpreadsheetItemReader(spreadsheetReader, resourceLoader.getResource(inputFile),
                importRunService, importRunId);
    }

    /**
     * Step-scoped so that every run loads its own reference catalog snapshot.
     */
    @Bean
    @StepScope
    public ImportRowItemProcessor importRowItemProcessor(
            ImportRowMapper rowMapper,
            ImportRowValidator validator,
            ReferenceCatalogLoader catalogLoader) {
        return new ImportRowItemProcessor(rowMapper, validator, catalogLoader);
    }

    /**
     * Step-scoped so that every run gets its own reconciliation engine and holder cache.
     */
    @Bean
    @StepScope
    public ReconciliationItemWriter reconciliationItemWriter(
            OfficeholderRegistry registry,
            ImportRunService importRunService,
            @Value("#{jobParameters['importRunId']}") String importRunId) {
        return new ReconciliationItemWriter(registry, importRunService, importRunId);
    }
}
