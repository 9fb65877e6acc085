package com.pulpulitiko.importprocessor.client;

import com.pulpulitiko.importprocessor.domain.AssignmentKey;
import com.pulpulitiko.importprocessor.domain.JurisdictionRef;
import com.pulpulitiko.importprocessor.domain.JurisdictionType;
import com.pulpulitiko.importprocessor.domain.OfficeholderAssignment;
import com.pulpulitiko.importprocessor.reconcile.OfficeholderRegistry;
import com.pulpulitiko.importprocessor.reconcile.RegistryException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * REST client for the registry-service (port 8082).
 *
 * <p>Maps the service's assignment endpoints onto {@link OfficeholderRegistry}. A {@code 409}
 * answer becomes a conflicting {@link RegistryException}; any other failure, including a full
 * {@code registryServiceBulkhead}, becomes a plain one. Nothing is retried.
 */
@Slf4j
@Component
public class OfficeholderRegistryClient implements OfficeholderRegistry {

    private static final String ASSIGNMENTS = "/api/v1/registry/assignments";

    private final RestClient restClient;
    private final Bulkhead bulkhead;

    public OfficeholderRegistryClient(
            RestClient.Builder builder,
            @Value("${downstream.registry-service.base-url}") String baseUrl,
            @Qualifier("registryServiceBulkhead") Bulkhead bulkhead) {
        this.restClient = builder.baseUrl(baseUrl).build();
        this.bulkhead = bulkhead;
    }

    // ─── Reads ───────────────────────────────────────────────────────────────

    /**
     * Calls {@code GET /api/v1/registry/assignments/current}. {@code 404} means the key is vacant.
     */
    @Override
    public Optional<OfficeholderAssignment> getCurrent(AssignmentKey key) {
        return call("get current holder of " + key, () -> {
            try {
                AssignmentPayload payload = restClient.get()
                        .uri(uriBuilder -> uriBuilder
                                .path(ASSIGNMENTS + "/current")
                                .queryParam("positionId", key.positionId())
                                .queryParam("jurisdictionType", key.jurisdiction().type().wireValue())
                                .queryParamIfPresent("jurisdictionId", Optional.ofNullable(key.jurisdiction().id()))
                                .build())
                        .retrieve()
                        .body(AssignmentPayload.class);
                return Optional.ofNullable(payload).map(OfficeholderRegistryClient::toDomain);
            } catch (HttpClientErrorException.NotFound e) {
                return Optional.empty();
            }
        });
    }

    @Override
    public List<OfficeholderAssignment> listCurrent() {
        AssignmentPayload[] payloads = call("list current assignments", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder.path(ASSIGNMENTS).queryParam("currentOnly", true).build())
                .retrieve()
                .body(AssignmentPayload[].class));
        return payloads == null ? List.of() : Arrays.stream(payloads)
                .map(OfficeholderRegistryClient::toDomain)
                .toList();
    }

    // ─── Writes ──────────────────────────────────────────────────────────────

    @Override
    public OfficeholderAssignment createAssignment(OfficeholderAssignment assignment) {
        AssignmentPayload payload = call("create assignment", () -> restClient.post()
                .uri(ASSIGNMENTS)
                .contentType(MediaType.APPLICATION_JSON)
                .body(CreatePayload.from(assignment))
                .retrieve()
                .body(AssignmentPayload.class));
        return toDomain(payload);
    }

    @Override
    public OfficeholderAssignment updateAssignment(String assignmentId, OfficeholderAssignment changes) {
        UpdatePayload body = new UpdatePayload(changes.getPartyId(), changes.getTermStart(), changes.getTermEnd(),
                changes.getPhotoUrl(), changes.getShortBio());
        AssignmentPayload payload = call("update assignment " + assignmentId, () -> restClient.put()
                .uri(ASSIGNMENTS + "/{id}", assignmentId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(AssignmentPayload.class));
        return toDomain(payload);
    }

    @Override
    public OfficeholderAssignment closeAssignment(String assignmentId, LocalDate termEnd, String endedReason) {
        AssignmentPayload payload = call("close assignment " + assignmentId, () -> restClient.post()
                .uri(ASSIGNMENTS + "/{id}/close", assignmentId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ClosePayload(termEnd, endedReason))
                .retrieve()
                .body(AssignmentPayload.class));
        return toDomain(payload);
    }

    @Override
    public OfficeholderAssignment replaceCurrent(String expectedCurrentId, LocalDate closeTermEnd, String endedReason,
                                                 OfficeholderAssignment successor) {
        ReplacePayload body = new ReplacePayload(expectedCurrentId, closeTermEnd, endedReason,
                CreatePayload.from(successor));
        AssignmentPayload payload = call("replace assignment " + expectedCurrentId, () -> restClient.post()
                .uri(ASSIGNMENTS + "/replace")
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(AssignmentPayload.class));
        return toDomain(payload);
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private <T> T call(String action, Supplier<T> supplier) {
        try {
            return Bulkhead.decorateSupplier(bulkhead, supplier).get();
        } catch (BulkheadFullException e) {
            log.warn("Bulkhead full, could not {}: {}", action, e.getMessage());
            throw new RegistryException("registry-service is busy", e);
        } catch (RestClientResponseException e) {
            boolean conflict = e.getStatusCode().value() == HttpStatus.CONFLICT.value();
            log.warn("registry-service rejected '{}' with {}: {}", action, e.getStatusCode().value(),
                    e.getResponseBodyAsString());
            throw new RegistryException("registry-service rejected %s with status %d"
                    .formatted(action, e.getStatusCode().value()), conflict, e);
        } catch (RestClientException e) {
            log.warn("registry-service call failed, could not {}: {}", action, e.getMessage());
            throw new RegistryException("registry-service unavailable", e);
        }
    }

    private static OfficeholderAssignment toDomain(AssignmentPayload payload) {
        if (payload == null) {
            throw new RegistryException("registry-service returned an empty body", null);
        }
        JurisdictionType type = JurisdictionType.fromText(payload.jurisdictionType())
                .orElseThrow(() -> new RegistryException(
                        "registry-service returned unknown jurisdiction type '%s'".formatted(payload.jurisdictionType()),
                        null));
        JurisdictionRef jurisdiction = type == JurisdictionType.NATIONAL
                ? JurisdictionRef.national()
                : JurisdictionRef.of(type, payload.jurisdictionId());
        return OfficeholderAssignment.builder()
                .id(payload.id())
                .politicianId(payload.politicianId())
                .politicianName(payload.politicianName())
                .politicianBirthDate(payload.politicianBirthDate())
                .positionId(payload.positionId())
                .partyId(payload.partyId())
                .jurisdiction(jurisdiction)
                .termStart(payload.termStart())
                .termEnd(payload.termEnd())
                .photoUrl(payload.photoUrl())
                .shortBio(payload.shortBio())
                .current(payload.current())
                .endedReason(payload.endedReason())
                .build();
    }

    // ─── Wire records (inline, keep client self-contained) ───────────────────

    public record AssignmentPayload(
            String id,
            String politicianId,
            String politicianName,
            LocalDate politicianBirthDate,
            String positionId,
            String partyId,
            String jurisdictionType,
            String jurisdictionId,
            LocalDate termStart,
            LocalDate termEnd,
            String photoUrl,
            String shortBio,
            boolean current,
            String endedReason) {}

    public record CreatePayload(
            String politicianName,
            LocalDate birthDate,
            String positionId,
            String partyId,
            String jurisdictionType,
            String jurisdictionId,
            LocalDate termStart,
            LocalDate termEnd,
            String photoUrl,
            String shortBio) {

        static CreatePayload from(OfficeholderAssignment a) {
            return new CreatePayload(a.getPoliticianName(), a.getPoliticianBirthDate(), a.getPositionId(),
                    a.getPartyId(), a.getJurisdiction().type().wireValue(), a.getJurisdiction().id(),
                    a.getTermStart(), a.getTermEnd(), a.getPhotoUrl(), a.getShortBio());
        }
    }

    public record UpdatePayload(String partyId, LocalDate termStart, LocalDate termEnd,
                                String photoUrl, String shortBio) {}

    public record ClosePayload(LocalDate termEnd, String endedReason) {}

    public record ReplacePayload(String expectedCurrentId, LocalDate closeTermEnd, String endedReason,
                                 CreatePayload assignment) {}
}
