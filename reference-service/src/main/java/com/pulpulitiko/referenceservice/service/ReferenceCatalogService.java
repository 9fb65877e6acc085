package com.pulpulitiko.referenceservice.service;

import com.pulpulitiko.referenceservice.config.ReferenceDataProperties;
import com.pulpulitiko.referenceservice.config.ReferenceDataProperties.PartyEntry;
import com.pulpulitiko.referenceservice.config.ReferenceDataProperties.PositionEntry;
import com.pulpulitiko.referenceservice.dto.PartyResponse;
import com.pulpulitiko.referenceservice.dto.PositionResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Service layer for position and party reference data.
 */
@Service
@RequiredArgsConstructor
public class ReferenceCatalogService {

    private final ReferenceDataProperties referenceDataProperties;

    /**
     * Returns all configured positions, in configuration order.
     */
    public List<PositionResponse> getAllPositions() {
        return referenceDataProperties.getPositions().stream()
                .map(this::toResponse)
                .toList();
    }

    /**
     * Returns all configured parties, in configuration order.
     */
    public List<PartyResponse> getAllParties() {
        return referenceDataProperties.getParties().stream()
                .map(this::toResponse)
                .toList();
    }

    /**
     * Finds a position by name, ignoring case and surrounding whitespace.
     */
    public Optional<PositionResponse> findPosition(String name) {
        String target = name == null ? "" : name.trim();
        return referenceDataProperties.getPositions().stream()
                .filter(e -> e.getName().trim().equalsIgnoreCase(target))
                .findFirst()
                .map(this::toResponse);
    }

    /**
     * Finds a party by name, ignoring case and surrounding whitespace.
     */
    public Optional<PartyResponse> findParty(String name) {
        String target = name == null ? "" : name.trim();
        return referenceDataProperties.getParties().stream()
                .filter(e -> e.getName().trim().equalsIgnoreCase(target))
                .findFirst()
                .map(this::toResponse);
    }

    private PositionResponse toResponse(PositionEntry entry) {
        return PositionResponse.builder()
                .id(ReferenceIds.resolve(entry.getId(), "position", entry.getName()))
                .name(entry.getName().trim())
                .level(entry.getLevel())
                .branch(entry.getBranch())
                .build();
    }

    private PartyResponse toResponse(PartyEntry entry) {
        return PartyResponse.builder()
                .id(ReferenceIds.resolve(entry.getId(), "party", entry.getName()))
                .name(entry.getName().trim())
                .abbreviation(entry.getAbbreviation())
                .build();
    }
}
