package com.pulpulitiko.importprocessor.reconcile;

import com.pulpulitiko.importprocessor.domain.AssignmentKey;
import com.pulpulitiko.importprocessor.domain.OfficeholderAssignment;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * The canonical store of officeholder assignments.
 *
 * <p>Implementations hold at most one current assignment per {@link AssignmentKey} and reject
 * writes that would break this. Every method throws {@link RegistryException} when the write is
 * rejected or the store cannot be reached; a rejected write has no side effects.
 */
public interface OfficeholderRegistry {

    Optional<OfficeholderAssignment> getCurrent(AssignmentKey key);

    /** Current assignments across all keys. */
    List<OfficeholderAssignment> listCurrent();

    /**
     * Creates a current assignment; fails if the key already has a current holder.
     */
    OfficeholderAssignment createAssignment(OfficeholderAssignment assignment);

    /**
     * Overwrites term dates, party, photo and bio of a current assignment. No history row is created.
     */
    OfficeholderAssignment updateAssignment(String assignmentId, OfficeholderAssignment changes);

    OfficeholderAssignment closeAssignment(String assignmentId, LocalDate termEnd, String endedReason);

    /**
     * Closes {@code expectedCurrentId} and creates {@code successor} as current in one atomic step.
     * Fails without side effects if {@code expectedCurrentId} is no longer current.
     *
     * @return the successor as stored
     */
    OfficeholderAssignment replaceCurrent(String expectedCurrentId, LocalDate closeTermEnd, String endedReason,
                                          OfficeholderAssignment successor);
}
