package com.pulpulitiko.registryservice.controller;

import com.pulpulitiko.registryservice.dto.AssignmentResponse;
import com.pulpulitiko.registryservice.service.OfficeholderRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/registry/politicians")
@RequiredArgsConstructor
@Tag(name = "Politicians", description = "Career history of registered politicians")
public class PoliticianController {

    private final OfficeholderRegistryService registryService;

    @GetMapping(value = "/{id}/history", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Position history of a politician", description = "Most recent term first.")
    public ResponseEntity<List<AssignmentResponse>> history(@PathVariable("id") String id) {
        return ResponseEntity.ok(registryService.history(id));
    }
}
