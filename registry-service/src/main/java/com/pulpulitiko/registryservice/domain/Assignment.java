package com.pulpulitiko.registryservice.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

/**
 * One politician holding one position within one jurisdiction for a term.
 *
 * <p>Closed assignments ({@code current == false}) are history and are never reopened.
 */
@Getter
@Setter
@Builder
public class Assignment {

    private final String id;

    private final Politician politician;

    private final AssignmentKey key;

    /** Nullable: independents have no party. */
    private String partyId;

    private LocalDate termStart;

    /** Open while {@code null}. */
    private LocalDate termEnd;

    private String photoUrl;

    private String shortBio;

    private boolean current;

    /** Why the assignment was closed, e.g. {@code replaced}; {@code null} while current. */
    private String endedReason;
}
