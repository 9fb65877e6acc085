package com.pulpulitiko.importprocessor.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One spreadsheet line keyed by normalized header name, with its 1-based sheet row number.
 * Values are trimmed; absent cells read as empty strings.
 */
public record RawRow(int rowNumber, Map<String, String> values) {

    public RawRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String get(String header) {
        return values.getOrDefault(header, "");
    }
}
