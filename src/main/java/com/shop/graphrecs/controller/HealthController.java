package com.shop.graphrecs.controller;

import com.shop.graphrecs.dto.HealthResponse;
import com.shop.graphrecs.service.StoreHealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Health", description = "Reachability of the relational and graph stores")
@RequiredArgsConstructor
public class HealthController {

    private final StoreHealthService storeHealthService;

    @GetMapping("/health")
    @Operation(summary = "Check both stores",
            description = "ok is true when PostgreSQL and Neo4j both answer a fresh round trip")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse(storeHealthService.isHealthy()));
    }
}
