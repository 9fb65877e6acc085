package com.pulpulitiko.importprocessor.catalog;

public record Party(String id, String name) {
}
