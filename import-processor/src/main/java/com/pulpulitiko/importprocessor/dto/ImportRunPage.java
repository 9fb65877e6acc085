package com.pulpulitiko.importprocessor.dto;

import com.pulpulitiko.importprocessor.domain.ImportRun;

import java.util.List;

/**
 * One page of the import log, newest run first.
 */
public record ImportRunPage(List<ImportRun> importRuns, int total, int page, int perPage, int totalPages) {}
