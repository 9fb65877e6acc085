package com.pulpulitiko.importprocessor.reconcile;

import com.pulpulitiko.importprocessor.domain.AssignmentKey;
import com.pulpulitiko.importprocessor.domain.OfficeholderAssignment;
import com.pulpulitiko.importprocessor.domain.ReconciliationAction;
import com.pulpulitiko.importprocessor.domain.ReconciliationOutcome;
import com.pulpulitiko.importprocessor.domain.ValidatedImportRow;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns valid rows into registry writes, one key at a time, in input order.
 *
 * <h3>Per (position, jurisdiction) key</h3>
 * <pre>
 *  no current holder                  ─► create                      CREATED
 *  same politician, nothing differs   ─► no write                    UNCHANGED
 *  same politician, fields differ     ─► update in place             UPDATED
 *  different politician               ─► replace (archive + create)  ARCHIVED_AND_CREATED
 *  registry rejects / unreachable     ─► nothing applied             FAILED
 * </pre>
 *
 * <p>A write the registry refuses because the holder changed under the import (a {@code 409})
 * fails with a message starting {@value #CONFLICT_PREFIX}.
 *
 * <p>The engine caches the current holder of every key it has touched, so a later row for the
 * same key sees the effect of an earlier one without another read. A failed write evicts the key
 * so the next row re-reads the registry.
 *
 * <p>One engine serves one import run; it is not thread-safe.
 */
@Slf4j
public class ReconciliationEngine {

    static final String ENDED_REASON_REPLACED = "replaced";
    static final String CONFLICT_PREFIX = "Current holder changed during import: ";

    private final OfficeholderRegistry registry;
    private final Map<AssignmentKey, Optional<OfficeholderAssignment>> staged = new HashMap<>();

    public ReconciliationEngine(OfficeholderRegistry registry) {
        this.registry = registry;
    }

    public List<ReconciliationOutcome> reconcileAll(List<ValidatedImportRow> rows) {
        return rows.stream().map(this::reconcile).toList();
    }

    public ReconciliationOutcome reconcile(ValidatedImportRow row) {
        if (!row.isValid()) {
            throw new IllegalArgumentException("Row " + row.getRowNumber() + " is invalid and cannot be reconciled");
        }
        AssignmentKey key = row.key();
        OfficeholderAssignment incoming = toAssignment(row);
        try {
            Optional<OfficeholderAssignment> current = staged.get(key);
            if (current == null) {
                current = registry.getCurrent(key);
            }

            if (current.isEmpty()) {
                OfficeholderAssignment created = registry.createAssignment(incoming);
                staged.put(key, Optional.of(created));
                log.debug("Row {}: created {} for {}", row.getRowNumber(), created.getId(), key);
                return ReconciliationOutcome.of(row.getRowNumber(), key, ReconciliationAction.CREATED, created.getId());
            }

            OfficeholderAssignment holder = current.get();
            if (isSamePolitician(holder, incoming)) {
                staged.put(key, current);
                if (!mutableFieldsDiffer(holder, incoming)) {
                    log.debug("Row {}: {} unchanged", row.getRowNumber(), holder.getId());
                    return ReconciliationOutcome.of(row.getRowNumber(), key, ReconciliationAction.UNCHANGED, holder.getId());
                }
                OfficeholderAssignment updated = registry.updateAssignment(holder.getId(), incoming);
                staged.put(key, Optional.of(updated));
                log.debug("Row {}: updated {} in place", row.getRowNumber(), holder.getId());
                return ReconciliationOutcome.of(row.getRowNumber(), key, ReconciliationAction.UPDATED, updated.getId());
            }

            LocalDate closeTermEnd = backfillTermEnd(holder, incoming.getTermStart());
            OfficeholderAssignment successor =
                    registry.replaceCurrent(holder.getId(), closeTermEnd, ENDED_REASON_REPLACED, incoming);
            staged.put(key, Optional.of(successor));
            log.debug("Row {}: archived {} (term end {}) and created {}",
                    row.getRowNumber(), holder.getId(), closeTermEnd, successor.getId());
            return ReconciliationOutcome.archived(row.getRowNumber(), key, successor.getId(), holder.getId());

        } catch (RegistryException e) {
            staged.remove(key);
            String message = e.isConflict() ? CONFLICT_PREFIX + e.getMessage() : e.getMessage();
            log.warn("Row {}: reconciliation failed for {}: {}", row.getRowNumber(), key, message);
            return ReconciliationOutcome.failed(row.getRowNumber(), key, message);
        }
    }

    // ─── Rules ───────────────────────────────────────────────────────────────

    /**
     * Same person when the normalized names match and the birth dates do not contradict each other.
     * An unknown birth date on either side matches on the name alone; exports carry no birth date.
     */
    static boolean isSamePolitician(OfficeholderAssignment holder, OfficeholderAssignment incoming) {
        if (!normalizeName(holder.getPoliticianName()).equals(normalizeName(incoming.getPoliticianName()))) {
            return false;
        }
        LocalDate a = holder.getPoliticianBirthDate();
        LocalDate b = incoming.getPoliticianBirthDate();
        return a == null || b == null || a.equals(b);
    }

    /**
     * The archived holder's term end: their own when already set, otherwise the day before the
     * successor starts, never earlier than the holder's own term start.
     */
    static LocalDate backfillTermEnd(OfficeholderAssignment holder, LocalDate successorStart) {
        if (holder.getTermEnd() != null) {
            return holder.getTermEnd();
        }
        LocalDate dayBefore = successorStart.minusDays(1);
        return dayBefore.isBefore(holder.getTermStart()) ? holder.getTermStart() : dayBefore;
    }

    private static boolean mutableFieldsDiffer(OfficeholderAssignment holder, OfficeholderAssignment incoming) {
        return !Objects.equals(holder.getTermStart(), incoming.getTermStart())
                || !Objects.equals(holder.getTermEnd(), incoming.getTermEnd())
                || !Objects.equals(holder.getPartyId(), incoming.getPartyId())
                || !Objects.equals(holder.getPhotoUrl(), incoming.getPhotoUrl())
                || !Objects.equals(holder.getShortBio(), incoming.getShortBio());
    }

    private static OfficeholderAssignment toAssignment(ValidatedImportRow row) {
        return OfficeholderAssignment.builder()
                .politicianName(row.getPoliticianName())
                .politicianBirthDate(row.getBirthDate())
                .positionId(row.getPositionId())
                .partyId(row.getPartyId())
                .jurisdiction(row.getJurisdiction())
                .termStart(row.getTermStart())
                .termEnd(row.getTermEnd())
                .photoUrl(row.getPhotoUrl())
                .shortBio(row.getShortBio())
                .current(true)
                .build();
    }

    private static String normalizeName(String name) {
        return name == null ? "" : name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
