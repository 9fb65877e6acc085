package com.pulpulitiko.importprocessor.catalog;

public record Position(String id, String name) {
}
