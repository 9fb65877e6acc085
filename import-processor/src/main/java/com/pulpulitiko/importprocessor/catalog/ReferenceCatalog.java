package com.pulpulitiko.importprocessor.catalog;

import com.pulpulitiko.importprocessor.domain.JurisdictionRef;
import com.pulpulitiko.importprocessor.domain.JurisdictionType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only snapshot of valid positions and parties, taken once at the start of an import run.
 *
 * <p>Name lookups are exact after trimming and case-folding. Jurisdiction lookups are delegated
 * to the {@link JurisdictionDirectory} the snapshot was built with. Instances are immutable and
 * safe to share between concurrent runs.
 */
public final class ReferenceCatalog {

    private final List<Position> positions;
    private final List<Party> parties;
    private final Map<String, Position> positionsByName;
    private final Map<String, Party> partiesByName;
    private final Map<String, Position> positionsById;
    private final Map<String, Party> partiesById;
    private final JurisdictionDirectory jurisdictionDirectory;

    public ReferenceCatalog(List<Position> positions, List<Party> parties, JurisdictionDirectory jurisdictionDirectory) {
        this.positions = List.copyOf(positions);
        this.parties = List.copyOf(parties);
        this.jurisdictionDirectory = Objects.requireNonNull(jurisdictionDirectory, "jurisdictionDirectory");

        Map<String, Position> positionIndex = new LinkedHashMap<>();
        Map<String, Position> positionIds = new LinkedHashMap<>();
        for (Position p : this.positions) {
            positionIndex.putIfAbsent(normalize(p.name()), p);
            positionIds.putIfAbsent(p.id(), p);
        }
        Map<String, Party> partyIndex = new LinkedHashMap<>();
        Map<String, Party> partyIds = new LinkedHashMap<>();
        for (Party p : this.parties) {
            partyIndex.putIfAbsent(normalize(p.name()), p);
            partyIds.putIfAbsent(p.id(), p);
        }
        this.positionsByName = Collections.unmodifiableMap(positionIndex);
        this.partiesByName = Collections.unmodifiableMap(partyIndex);
        this.positionsById = Collections.unmodifiableMap(positionIds);
        this.partiesById = Collections.unmodifiableMap(partyIds);
    }

    public Optional<Position> findPosition(String name) {
        return Optional.ofNullable(positionsByName.get(normalize(name)));
    }

    public Optional<Party> findParty(String name) {
        return Optional.ofNullable(partiesByName.get(normalize(name)));
    }

    /**
     * Resolves a jurisdiction. National needs no lookup and never touches the directory.
     *
     * @throws JurisdictionNotFoundException when the directory has no such jurisdiction
     * @throws ReferenceDataException        when the directory cannot be reached
     */
    public JurisdictionRef lookupJurisdiction(JurisdictionType type, String name) {
        if (type == JurisdictionType.NATIONAL) {
            return JurisdictionRef.national();
        }
        return jurisdictionDirectory.lookup(type, name.trim());
    }

    /** Display name of a resolved jurisdiction; empty for national. */
    public String jurisdictionName(JurisdictionRef ref) {
        return ref.isNational() ? "" : jurisdictionDirectory.nameOf(ref);
    }

    public Optional<Position> positionById(String id) {
        return Optional.ofNullable(id).map(positionsById::get);
    }

    public Optional<Party> partyById(String id) {
        return Optional.ofNullable(id).map(partiesById::get);
    }

    /** Position names in catalog order; the candidate list for suggestions. */
    public List<String> positionNames() {
        return positions.stream().map(Position::name).toList();
    }

    /** Party names in catalog order; the candidate list for suggestions. */
    public List<String> partyNames() {
        return parties.stream().map(Party::name).toList();
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
