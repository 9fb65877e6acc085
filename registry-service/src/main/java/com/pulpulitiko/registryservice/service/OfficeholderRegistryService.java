package com.pulpulitiko.registryservice.service;

import com.pulpulitiko.registryservice.config.RegistryProperties;
import com.pulpulitiko.registryservice.config.RegistryProperties.SeedAssignment;
import com.pulpulitiko.registryservice.domain.Assignment;
import com.pulpulitiko.registryservice.domain.AssignmentKey;
import com.pulpulitiko.registryservice.domain.Politician;
import com.pulpulitiko.registryservice.dto.AssignmentResponse;
import com.pulpulitiko.registryservice.dto.CloseAssignmentRequest;
import com.pulpulitiko.registryservice.dto.CreateAssignmentRequest;
import com.pulpulitiko.registryservice.dto.ReplaceAssignmentRequest;
import com.pulpulitiko.registryservice.dto.UpdateAssignmentRequest;
import com.pulpulitiko.registryservice.exception.AssignmentConflictException;
import com.pulpulitiko.registryservice.exception.AssignmentNotFoundException;
import com.pulpulitiko.registryservice.exception.InvalidTermException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory officeholder registry.
 *
 * <p>Every public method runs under the service's monitor, so a read-modify-write of
 * "current holder" for a key is serialized against every other writer. The store holds
 * at most one current assignment per {@link AssignmentKey}; writes that would break this
 * fail with {@link AssignmentConflictException} before anything is changed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OfficeholderRegistryService {

    private static final String REASON_REPLACED = "replaced";

    private final RegistryProperties registryProperties;

    private final Map<String, Assignment> assignments = new LinkedHashMap<>();
    private final Map<AssignmentKey, String> currentByKey = new HashMap<>();
    private final List<Politician> politicians = new ArrayList<>();

    private boolean seeded;

    // ─── Queries ─────────────────────────────────────────────────────────────────

    public synchronized Optional<AssignmentResponse> getCurrent(String positionId, String jurisdictionType,
                                                                String jurisdictionId) {
        ensureSeeded();
        AssignmentKey key = AssignmentKey.of(positionId, jurisdictionType, jurisdictionId);
        return Optional.ofNullable(currentByKey.get(key))
                .map(assignments::get)
                .map(this::toResponse);
    }

    public synchronized AssignmentResponse getById(String id) {
        ensureSeeded();
        return toResponse(require(id));
    }

    public synchronized List<AssignmentResponse> list(boolean currentOnly) {
        ensureSeeded();
        return assignments.values().stream()
                .filter(a -> !currentOnly || a.isCurrent())
                .map(this::toResponse)
                .toList();
    }

    /**
     * Career timeline of one politician, most recent term first.
     */
    public synchronized List<AssignmentResponse> history(String politicianId) {
        ensureSeeded();
        return assignments.values().stream()
                .filter(a -> a.getPolitician().getId().equals(politicianId))
                .sorted(Comparator.comparing(Assignment::getTermStart).reversed())
                .map(this::toResponse)
                .toList();
    }

    // ─── Commands ────────────────────────────────────────────────────────────────

    public synchronized AssignmentResponse create(CreateAssignmentRequest request) {
        ensureSeeded();
        AssignmentKey key = keyOf(request);
        checkTerm(request.getTermStart(), request.getTermEnd());

        String holderId = currentByKey.get(key);
        if (holderId != null) {
            throw new AssignmentConflictException(
                    "Position '%s' in %s '%s' already has a current holder (%s)."
                            .formatted(key.positionId(), key.jurisdictionType(), key.jurisdictionId(), holderId));
        }
        return toResponse(insert(key, request));
    }

    public synchronized AssignmentResponse update(String id, UpdateAssignmentRequest request) {
        ensureSeeded();
        Assignment assignment = require(id);
        if (!assignment.isCurrent()) {
            throw new AssignmentConflictException("Assignment '%s' is archived and cannot be updated.".formatted(id));
        }
        checkTerm(request.getTermStart(), request.getTermEnd());

        assignment.setPartyId(blankToNull(request.getPartyId()));
        assignment.setTermStart(request.getTermStart());
        assignment.setTermEnd(request.getTermEnd());
        assignment.setPhotoUrl(blankToNull(request.getPhotoUrl()));
        assignment.setShortBio(blankToNull(request.getShortBio()));
        log.debug("Updated assignment {} in place", id);
        return toResponse(assignment);
    }

    public synchronized AssignmentResponse close(String id, CloseAssignmentRequest request) {
        ensureSeeded();
        Assignment assignment = require(id);
        if (!assignment.isCurrent()) {
            throw new AssignmentConflictException("Assignment '%s' is already closed.".formatted(id));
        }
        LocalDate termEnd = resolveCloseTermEnd(assignment, request == null ? null : request.getTermEnd());
        checkTerm(assignment.getTermStart(), termEnd);

        String reason = request == null || request.getEndedReason() == null || request.getEndedReason().isBlank()
                ? registryProperties.getDefaultEndedReason()
                : request.getEndedReason();
        archive(assignment, termEnd, reason);
        return toResponse(assignment);
    }

    /**
     * Closes the expected current holder and installs the successor as one step.
     * All checks run before the first mutation, so a rejected call leaves the store unchanged.
     */
    public synchronized AssignmentResponse replace(ReplaceAssignmentRequest request) {
        ensureSeeded();
        CreateAssignmentRequest successor = request.getAssignment();
        AssignmentKey key = keyOf(successor);
        Assignment previous = require(request.getExpectedCurrentId());

        if (!previous.isCurrent() || !previous.getId().equals(currentByKey.get(key))) {
            throw new AssignmentConflictException(
                    "Assignment '%s' is no longer the current holder of position '%s' in %s '%s'."
                            .formatted(previous.getId(), key.positionId(), key.jurisdictionType(), key.jurisdictionId()));
        }
        LocalDate closeTermEnd = resolveCloseTermEnd(previous, request.getCloseTermEnd());
        checkTerm(previous.getTermStart(), closeTermEnd);
        checkTerm(successor.getTermStart(), successor.getTermEnd());

        String reason = request.getEndedReason() == null || request.getEndedReason().isBlank()
                ? REASON_REPLACED
                : request.getEndedReason();
        archive(previous, closeTermEnd, reason);
        Assignment created = insert(key, successor);
        log.info("Replaced {} with {} for position '{}' in {} '{}'",
                previous.getPolitician().getName(), created.getPolitician().getName(),
                key.positionId(), key.jurisdictionType(), key.jurisdictionId());
        return toResponse(created);
    }

    // ─── Internal helpers ────────────────────────────────────────────────────────

    private Assignment insert(AssignmentKey key, CreateAssignmentRequest request) {
        Assignment assignment = Assignment.builder()
                .id(UUID.randomUUID().toString())
                .politician(findOrRegister(request.getPoliticianName(), request.getBirthDate()))
                .key(key)
                .partyId(blankToNull(request.getPartyId()))
                .termStart(request.getTermStart())
                .termEnd(request.getTermEnd())
                .photoUrl(blankToNull(request.getPhotoUrl()))
                .shortBio(blankToNull(request.getShortBio()))
                .current(true)
                .build();
        assignments.put(assignment.getId(), assignment);
        currentByKey.put(key, assignment.getId());
        log.debug("Created assignment {} for {}", assignment.getId(), assignment.getPolitician().getName());
        return assignment;
    }

    private void archive(Assignment assignment, LocalDate termEnd, String reason) {
        assignment.setTermEnd(termEnd);
        assignment.setCurrent(false);
        assignment.setEndedReason(reason);
        currentByKey.remove(assignment.getKey(), assignment.getId());
        log.debug("Archived assignment {} with termEnd={} reason={}", assignment.getId(), termEnd, reason);
    }

    private Politician findOrRegister(String name, LocalDate birthDate) {
        for (Politician politician : politicians) {
            if (politician.isSamePerson(name, birthDate)) {
                if (politician.getBirthDate() == null && birthDate != null) {
                    politician.setBirthDate(birthDate);
                }
                return politician;
            }
        }
        Politician politician = new Politician(UUID.randomUUID().toString(), name.trim(), birthDate);
        politicians.add(politician);
        log.debug("Registered politician {} ({})", politician.getName(), politician.getId());
        return politician;
    }

    private Assignment require(String id) {
        Assignment assignment = assignments.get(id);
        if (assignment == null) {
            throw new AssignmentNotFoundException("Assignment '%s' not found.".formatted(id));
        }
        return assignment;
    }

    private static LocalDate resolveCloseTermEnd(Assignment assignment, LocalDate requested) {
        if (requested != null) {
            return requested;
        }
        return assignment.getTermEnd() != null ? assignment.getTermEnd() : LocalDate.now();
    }

    private static void checkTerm(LocalDate termStart, LocalDate termEnd) {
        if (termStart != null && termEnd != null && termEnd.isBefore(termStart)) {
            throw new InvalidTermException(
                    "Term end %s must not be before term start %s.".formatted(termEnd, termStart));
        }
    }

    private static AssignmentKey keyOf(CreateAssignmentRequest request) {
        return AssignmentKey.of(request.getPositionId(), request.getJurisdictionType(), request.getJurisdictionId());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private AssignmentResponse toResponse(Assignment assignment) {
        return AssignmentResponse.builder()
                .id(assignment.getId())
                .politicianId(assignment.getPolitician().getId())
                .politicianName(assignment.getPolitician().getName())
                .politicianBirthDate(assignment.getPolitician().getBirthDate())
                .positionId(assignment.getKey().positionId())
                .partyId(assignment.getPartyId())
                .jurisdictionType(assignment.getKey().jurisdictionType())
                .jurisdictionId(assignment.getKey().jurisdictionId())
                .termStart(assignment.getTermStart())
                .termEnd(assignment.getTermEnd())
                .photoUrl(assignment.getPhotoUrl())
                .shortBio(assignment.getShortBio())
                .current(assignment.isCurrent())
                .endedReason(assignment.getEndedReason())
                .build();
    }

    /**
     * Loads the configured seed assignments once, on first access.
     * Callers already hold the monitor.
     */
    private void ensureSeeded() {
        if (seeded) {
            return;
        }
        seeded = true;
        for (SeedAssignment seed : registryProperties.getSeed()) {
            CreateAssignmentRequest request = CreateAssignmentRequest.builder()
                    .politicianName(seed.getPoliticianName())
                    .birthDate(seed.getBirthDate())
                    .positionId(seed.getPositionId())
                    .partyId(seed.getPartyId())
                    .jurisdictionType(seed.getJurisdictionType())
                    .jurisdictionId(seed.getJurisdictionId())
                    .termStart(seed.getTermStart())
                    .termEnd(seed.getTermEnd())
                    .photoUrl(seed.getPhotoUrl())
                    .shortBio(seed.getShortBio())
                    .build();
            insert(keyOf(request), request);
        }
        log.info("Officeholder registry seeded with {} assignments", assignments.size());
    }
}
