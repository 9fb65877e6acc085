package com.pulpulitiko.importprocessor.dto;

public record ErrorResponse(String code, String message) {}
