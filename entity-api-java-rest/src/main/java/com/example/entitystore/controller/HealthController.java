package com.example.entitystore.controller;

import com.example.entitystore.dto.HealthResponse;
import com.example.entitystore.service.EntityService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final EntityService entityService;

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        return entityService.isDatabaseHealthy()
                .map(healthy -> healthy
                        ? ResponseEntity.ok(HealthResponse.builder()
                            .status("healthy")
                            .database("up")
                            .build())
                        : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(HealthResponse.builder()
                            .status("unhealthy")
                            .database("down")
                            .build()));
    }
}
