package com.pulpulitiko.importprocessor.service;

import com.pulpulitiko.importprocessor.batch.ImportRunListener;
import com.pulpulitiko.importprocessor.config.ImportProperties;
import com.pulpulitiko.importprocessor.domain.ImportRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionException;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Locale;

/**
 * Accepts an uploaded spreadsheet, stores it under {@code importer.upload-dir} and launches
 * {@code officeholderImportJob} for it in the background.
 */
@Slf4j
@Service
public class ImportJobService {

    private final JobLauncher asyncJobLauncher;
    private final Job officeholderImportJob;
    private final ImportRunService importRunService;
    private final ImportProperties importProperties;

    public ImportJobService(@Qualifier("asyncJobLauncher") JobLauncher asyncJobLauncher,
                            Job officeholderImportJob,
                            ImportRunService importRunService,
                            ImportProperties importProperties) {
        this.asyncJobLauncher = asyncJobLauncher;
        this.officeholderImportJob = officeholderImportJob;
        this.importRunService = importRunService;
        this.importProperties = importProperties;
    }

    /**
     * @return the new run, already linked to its job execution
     * @throws IOException           if the upload cannot be stored
     * @throws JobExecutionException if the job cannot be launched
     */
    public ImportRun submit(String filename, InputStream content) throws IOException, JobExecutionException {
        ImportRun run = importRunService.create(filename);

        Path uploadDir = Paths.get(importProperties.getUploadDir());
        Files.createDirectories(uploadDir);
        Path stored = uploadDir.resolve(run.getId() + extensionOf(filename));
        Files.copy(content, stored, StandardCopyOption.REPLACE_EXISTING);

        JobParameters params = new JobParametersBuilder()
                .addString(ImportRunListener.INPUT_FILE, stored.toUri().toString())
                .addString(ImportRunListener.IMPORT_RUN_ID, run.getId())
                .addLong("startedAt", Instant.now().toEpochMilli())   // ensures unique run
                .toJobParameters();

        log.info("Starting officeholderImportJob for '{}' as import run {}", filename, run.getId());
        try {
            // asyncJobLauncher returns immediately; the job runs in the background
            JobExecution execution = asyncJobLauncher.run(officeholderImportJob, params);
            importRunService.attachJob(run.getId(), stored.toString(), execution.getId());
        } catch (JobExecutionException e) {
            importRunService.markFailed(run.getId(), "Failed to start import job: " + e.getMessage());
            throw e;
        }
        return importRunService.find(run.getId()).orElse(run);
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return ".xlsx";
        }
        int dot = filename.lastIndexOf('.');
        String extension = dot < 0 ? "" : filename.substring(dot).toLowerCase(Locale.ROOT);
        return extension.matches("\\.[a-z]{3,4}") ? extension : ".xlsx";
    }
}
