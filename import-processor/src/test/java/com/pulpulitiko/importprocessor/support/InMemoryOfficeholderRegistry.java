package com.pulpulitiko.importprocessor.support;

import com.pulpulitiko.importprocessor.domain.AssignmentKey;
import com.pulpulitiko.importprocessor.domain.OfficeholderAssignment;
import com.pulpulitiko.importprocessor.reconcile.OfficeholderRegistry;
import com.pulpulitiko.importprocessor.reconcile.RegistryException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Registry fake with the same rules as registry-service: one current holder per key, and
 * conflicting writes are rejected without side effects. {@link #rejectWritesFor} makes every
 * write for one position fail as a downstream error would.
 */
public class InMemoryOfficeholderRegistry implements OfficeholderRegistry {

    private final Map<String, OfficeholderAssignment> assignments = new LinkedHashMap<>();
    private final Map<AssignmentKey, String> currentByKey = new HashMap<>();
    private final Map<String, String> politicianIds = new HashMap<>();
    private final List<String> rejectedPositions = new ArrayList<>();

    private int writes;

    public InMemoryOfficeholderRegistry rejectWritesFor(String positionId) {
        rejectedPositions.add(positionId);
        return this;
    }

    public InMemoryOfficeholderRegistry acceptAllWrites() {
        rejectedPositions.clear();
        return this;
    }

    public int writeCount() {
        return writes;
    }

    public List<OfficeholderAssignment> all() {
        return List.copyOf(assignments.values());
    }

    public List<OfficeholderAssignment> currentFor(AssignmentKey key) {
        return assignments.values().stream()
                .filter(a -> a.isCurrent() && a.key().equals(key))
                .toList();
    }

    /** Seeds a current holder directly, bypassing the write counter. */
    public OfficeholderAssignment seed(OfficeholderAssignment assignment) {
        OfficeholderAssignment stored = store(assignment);
        return stored.toBuilder().build();
    }

    @Override
    public Optional<OfficeholderAssignment> getCurrent(AssignmentKey key) {
        return Optional.ofNullable(currentByKey.get(key))
                .map(assignments::get)
                .map(a -> a.toBuilder().build());
    }

    @Override
    public List<OfficeholderAssignment> listCurrent() {
        return assignments.values().stream()
                .filter(OfficeholderAssignment::isCurrent)
                .map(a -> a.toBuilder().build())
                .toList();
    }

    @Override
    public OfficeholderAssignment createAssignment(OfficeholderAssignment assignment) {
        checkAccepted(assignment.getPositionId());
        if (currentByKey.containsKey(assignment.key())) {
            throw new RegistryException("key already has a current holder", true, null);
        }
        writes++;
        return store(assignment).toBuilder().build();
    }

    @Override
    public OfficeholderAssignment updateAssignment(String assignmentId, OfficeholderAssignment changes) {
        OfficeholderAssignment existing = require(assignmentId);
        checkAccepted(existing.getPositionId());
        if (!existing.isCurrent()) {
            throw new RegistryException("assignment is archived", true, null);
        }
        writes++;
        existing.setPartyId(changes.getPartyId());
        existing.setTermStart(changes.getTermStart());
        existing.setTermEnd(changes.getTermEnd());
        existing.setPhotoUrl(changes.getPhotoUrl());
        existing.setShortBio(changes.getShortBio());
        return existing.toBuilder().build();
    }

    @Override
    public OfficeholderAssignment closeAssignment(String assignmentId, LocalDate termEnd, String endedReason) {
        OfficeholderAssignment existing = require(assignmentId);
        checkAccepted(existing.getPositionId());
        if (!existing.isCurrent()) {
            throw new RegistryException("assignment already closed", true, null);
        }
        writes++;
        archive(existing, termEnd, endedReason);
        return existing.toBuilder().build();
    }

    @Override
    public OfficeholderAssignment replaceCurrent(String expectedCurrentId, LocalDate closeTermEnd, String endedReason,
                                                 OfficeholderAssignment successor) {
        OfficeholderAssignment previous = require(expectedCurrentId);
        checkAccepted(successor.getPositionId());
        if (!previous.isCurrent() || !expectedCurrentId.equals(currentByKey.get(successor.key()))) {
            throw new RegistryException("expected holder is no longer current", true, null);
        }
        writes++;
        archive(previous, closeTermEnd, endedReason);
        return store(successor).toBuilder().build();
    }

    // ─── helpers ─────────────────────────────────────────────────────────────

    private OfficeholderAssignment store(OfficeholderAssignment assignment) {
        String politicianKey = assignment.getPoliticianName().trim().toLowerCase(Locale.ROOT);
        OfficeholderAssignment stored = assignment.toBuilder()
                .id(UUID.randomUUID().toString())
                .politicianId(politicianIds.computeIfAbsent(politicianKey, k -> UUID.randomUUID().toString()))
                .current(true)
                .endedReason(null)
                .build();
        assignments.put(stored.getId(), stored);
        currentByKey.put(stored.key(), stored.getId());
        return stored;
    }

    private void archive(OfficeholderAssignment assignment, LocalDate termEnd, String reason) {
        assignment.setTermEnd(termEnd);
        assignment.setCurrent(false);
        assignment.setEndedReason(reason);
        currentByKey.remove(assignment.key(), assignment.getId());
    }

    private OfficeholderAssignment require(String id) {
        OfficeholderAssignment assignment = assignments.get(id);
        if (assignment == null) {
            throw new RegistryException("assignment " + id + " not found", null);
        }
        return assignment;
    }

    private void checkAccepted(String positionId) {
        if (rejectedPositions.contains(positionId)) {
            throw new RegistryException("registry-service unavailable", null);
        }
    }
}
