package com.pulpulitiko.importprocessor.exception;

public class ImportRunNotFoundException extends RuntimeException {

    public ImportRunNotFoundException(String importRunId) {
        super("Import run '%s' not found.".formatted(importRunId));
    }
}
