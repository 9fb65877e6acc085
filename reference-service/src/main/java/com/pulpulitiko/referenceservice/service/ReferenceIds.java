package com.pulpulitiko.referenceservice.service;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;

/**
 * Stable ids for reference entries configured without one.
 * The same kind and name always yield the same id, so ids survive restarts.
 */
final class ReferenceIds {

    private ReferenceIds() {
    }

    static String resolve(String configuredId, String kind, String name) {
        if (configuredId != null && !configuredId.isBlank()) {
            return configuredId.trim();
        }
        String seed = kind + ":" + name.trim().toLowerCase(Locale.ROOT);
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
