package com.pulpulitiko.importprocessor.domain;

public enum ImportRunStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
