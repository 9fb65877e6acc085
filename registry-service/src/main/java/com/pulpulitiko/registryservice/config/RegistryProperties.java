package com.pulpulitiko.registryservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code registry} section from application.yml.
 * <p>
 * Holds the officeholder assignments the in-memory registry starts with.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "registry")
public class RegistryProperties {

    /** Ended reason recorded by a close call that does not supply one. */
    private String defaultEndedReason = "term_ended";

    /** Seeded current assignments, loaded on first access. */
    private List<SeedAssignment> seed = new ArrayList<>();

    @Getter
    @Setter
    public static class SeedAssignment {
        private String politicianName;
        private LocalDate birthDate;
        private String positionId;
        private String partyId;
        /** national, region, province, city, barangay or district. */
        private String jurisdictionType;
        /** Blank for national positions. */
        private String jurisdictionId;
        private LocalDate termStart;
        private LocalDate termEnd;
        private String photoUrl;
        private String shortBio;
    }
}
