package com.pulpulitiko.importprocessor.batch;

import com.pulpulitiko.importprocessor.config.ImportProperties;
import com.pulpulitiko.importprocessor.service.ImportRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionListener;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Moves the {@link com.pulpulitiko.importprocessor.domain.ImportRun} named by the
 * {@code importRunId} job parameter through PROCESSING to COMPLETED or FAILED.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImportRunListener implements JobExecutionListener {

    public static final String IMPORT_RUN_ID = "importRunId";
    public static final String INPUT_FILE = "inputFile";

    private final ImportRunService importRunService;
    private final ImportProperties importProperties;

    @Override
    public void beforeJob(JobExecution jobExecution) {
        String runId = jobExecution.getJobParameters().getString(IMPORT_RUN_ID);
        log.info("officeholderImportJob {} started for import run {}", jobExecution.getId(), runId);
        importRunService.markProcessing(runId);
    }

    @Override
    public void afterJob(JobExecution jobExecution) {
        String runId = jobExecution.getJobParameters().getString(IMPORT_RUN_ID);
        if (jobExecution.getStatus() == BatchStatus.COMPLETED) {
            importRunService.markCompleted(runId);
        } else {
            importRunService.markFailed(runId, describeFailure(jobExecution));
        }
        discardUpload(jobExecution.getJobParameters().getString(INPUT_FILE));
    }

    /**
     * Deletes the stored upload once the run is over. Only files inside
     * {@code importer.upload-dir} are touched.
     */
    void discardUpload(String inputFile) {
        if (inputFile == null || !inputFile.startsWith("file:")) {
            return;
        }
        Path file = Paths.get(URI.create(inputFile)).toAbsolutePath().normalize();
        Path uploadDir = Paths.get(importProperties.getUploadDir()).toAbsolutePath().normalize();
        if (!file.startsWith(uploadDir)) {
            return;
        }
        try {
            Files.deleteIfExists(file);
            log.debug("Deleted stored upload {}", file);
        } catch (IOException e) {
            log.warn("Could not delete stored upload {}: {}", file, e.getMessage());
        }
    }

    /**
     * First failure of the job, with the step framework's wrapping removed.
     */
    static String describeFailure(JobExecution jobExecution) {
        List<Throwable> failures = jobExecution.getAllFailureExceptions();
        if (failures.isEmpty()) {
            return "Import job ended with status " + jobExecution.getStatus();
        }
        Throwable cause = failures.get(0);
        while (cause instanceof ItemStreamException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
