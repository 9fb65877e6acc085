package com.pulpulitiko.referenceservice.service;

import com.pulpulitiko.referenceservice.config.ReferenceDataProperties;
import com.pulpulitiko.referenceservice.config.ReferenceDataProperties.JurisdictionEntry;
import com.pulpulitiko.referenceservice.dto.JurisdictionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Jurisdiction directory. Resolves (type, name) pairs to jurisdiction ids.
 *
 * <p>Matching is exact after trimming and case-folding; there is no fuzzy matching of
 * jurisdiction names. The {@code national} type has no entries and is never resolved here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JurisdictionService {

    private final ReferenceDataProperties referenceDataProperties;

    public List<JurisdictionResponse> getByType(String type) {
        return entriesOfType(type).stream()
                .map(this::toResponse)
                .toList();
    }

    /**
     * Looks up a jurisdiction of the given type by name.
     *
     * @return the jurisdiction, or empty when no entry of that type has the name
     */
    public Optional<JurisdictionResponse> lookup(String type, String name) {
        String target = name == null ? "" : name.trim();
        Optional<JurisdictionResponse> found = entriesOfType(type).stream()
                .filter(e -> e.getName().trim().equalsIgnoreCase(target))
                .findFirst()
                .map(this::toResponse);
        if (found.isEmpty()) {
            log.debug("Jurisdiction not found: type={}, name='{}'", type, name);
        }
        return found;
    }

    public Optional<JurisdictionResponse> findById(String type, String id) {
        return entriesOfType(type).stream()
                .map(this::toResponse)
                .filter(r -> r.getId().equals(id))
                .findFirst();
    }

    private List<JurisdictionEntry> entriesOfType(String type) {
        String normalized = type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
        return referenceDataProperties.getJurisdictions().stream()
                .filter(e -> e.getType().trim().equalsIgnoreCase(normalized))
                .toList();
    }

    private JurisdictionResponse toResponse(JurisdictionEntry entry) {
        String type = entry.getType().trim().toLowerCase(Locale.ROOT);
        return JurisdictionResponse.builder()
                .id(ReferenceIds.resolve(entry.getId(), type, entry.getName()))
                .type(type)
                .name(entry.getName().trim())
                .build();
    }
}
