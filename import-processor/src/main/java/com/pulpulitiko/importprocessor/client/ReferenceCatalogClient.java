package com.pulpulitiko.importprocessor.client;

import com.pulpulitiko.importprocessor.catalog.JurisdictionDirectory;
import com.pulpulitiko.importprocessor.catalog.JurisdictionNotFoundException;
import com.pulpulitiko.importprocessor.catalog.Party;
import com.pulpulitiko.importprocessor.catalog.Position;
import com.pulpulitiko.importprocessor.catalog.ReferenceCatalog;
import com.pulpulitiko.importprocessor.catalog.ReferenceCatalogLoader;
import com.pulpulitiko.importprocessor.catalog.ReferenceDataException;
import com.pulpulitiko.importprocessor.domain.JurisdictionRef;
import com.pulpulitiko.importprocessor.domain.JurisdictionType;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * REST client for the reference-service (port 8081).
 *
 * <p>Provides the two reference lookups an import needs:
 * <ul>
 *   <li>The position and party catalog, fetched once per run.</li>
 *   <li>Jurisdiction resolution by type and name, per row.</li>
 * </ul>
 * Every call goes through the {@code referenceServiceBulkhead}.
 */
@Slf4j
@Component
public class ReferenceCatalogClient implements ReferenceCatalogLoader, JurisdictionDirectory {

    private final RestClient restClient;
    private final Bulkhead bulkhead;

    public ReferenceCatalogClient(
            RestClient.Builder builder,
            @Value("${downstream.reference-service.base-url}") String baseUrl,
            @Qualifier("referenceServiceBulkhead") Bulkhead bulkhead) {
        this.restClient = builder.baseUrl(baseUrl).build();
        this.bulkhead = bulkhead;
    }

    // ─── Catalog ──────────────────────────────────────────────────────────────

    /**
     * Calls {@code GET /api/v1/reference/positions} and {@code GET /api/v1/reference/parties}.
     */
    @Override
    public ReferenceCatalog loadCatalog() {
        PositionPayload[] positions = call("load positions", () -> restClient.get()
                .uri("/api/v1/reference/positions")
                .retrieve()
                .body(PositionPayload[].class));
        PartyPayload[] parties = call("load parties", () -> restClient.get()
                .uri("/api/v1/reference/parties")
                .retrieve()
                .body(PartyPayload[].class));

        List<Position> positionList = positions == null ? List.of() : Arrays.stream(positions)
                .map(p -> new Position(p.id(), p.name()))
                .toList();
        List<Party> partyList = parties == null ? List.of() : Arrays.stream(parties)
                .map(p -> new Party(p.id(), p.name()))
                .toList();
        log.info("Reference catalog loaded: {} positions, {} parties", positionList.size(), partyList.size());
        return new ReferenceCatalog(positionList, partyList, this);
    }

    // ─── Jurisdictions ────────────────────────────────────────────────────────

    /**
     * Calls {@code GET /api/v1/reference/jurisdictions/{type}/lookup?name=}.
     */
    @Override
    public JurisdictionRef lookup(JurisdictionType type, String name) {
        JurisdictionPayload payload = call("look up " + type.wireValue() + " '" + name + "'", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/reference/jurisdictions/{type}/lookup")
                        .queryParam("name", name)
                        .build(type.wireValue()))
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(), (request, response) -> {
                    throw new JurisdictionNotFoundException(type, name);
                })
                .body(JurisdictionPayload.class));
        if (payload == null) {
            throw new JurisdictionNotFoundException(type, name);
        }
        return JurisdictionRef.of(type, payload.id());
    }

    /**
     * Calls {@code GET /api/v1/reference/jurisdictions/{type}/{id}}.
     */
    @Override
    public String nameOf(JurisdictionRef ref) {
        JurisdictionPayload payload = call("resolve " + ref.type().wireValue() + " " + ref.id(), () -> restClient.get()
                .uri("/api/v1/reference/jurisdictions/{type}/{id}", ref.type().wireValue(), ref.id())
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(), (request, response) -> {
                    throw new JurisdictionNotFoundException(ref.type(), ref.id());
                })
                .body(JurisdictionPayload.class));
        if (payload == null) {
            throw new JurisdictionNotFoundException(ref.type(), ref.id());
        }
        return payload.name();
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private <T> T call(String action, Supplier<T> supplier) {
        try {
            return Bulkhead.decorateSupplier(bulkhead, supplier).get();
        } catch (BulkheadFullException e) {
            log.warn("Bulkhead full, could not {}: {}", action, e.getMessage());
            throw new ReferenceDataException("reference-service is busy", e);
        } catch (RestClientException e) {
            log.warn("reference-service call failed, could not {}: {}", action, e.getMessage());
            throw new ReferenceDataException("reference-service unavailable", e);
        }
    }

    // ─── Response records (inline, keep client self-contained) ───────────────

    public record PositionPayload(String id, String name, String level, String branch) {}

    public record PartyPayload(String id, String name, String abbreviation) {}

    public record JurisdictionPayload(String id, String type, String name) {}
}
