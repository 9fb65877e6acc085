package com.pulpulitiko.registryservice.dto;

public record ErrorResponse(String code, String message) {}
