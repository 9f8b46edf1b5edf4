package com.example.entitystore.controller;

import com.example.entitystore.dto.EntityCreate;
import com.example.entitystore.dto.ErrorResponse;
import com.example.entitystore.query.EntityFilterBuilder;
import com.example.entitystore.query.EntityQuery;
import com.example.entitystore.query.FilterResult;
import com.example.entitystore.query.QueryError;
import com.example.entitystore.service.EntityService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/entities")
@RequiredArgsConstructor
@Slf4j
public class EntityController {

    static final String NOT_FOUND_DETAIL = "Entity not found";

    private final EntityService entityService;
    private final EntityFilterBuilder filterBuilder;

    @PostMapping
    public Mono<ResponseEntity<Object>> createEntity(@Valid @RequestBody EntityCreate request) {
        return entityService.create(request)
                .map(entity -> ResponseEntity.ok().<Object>body(entity));
    }

    @GetMapping("/{entityId}")
    public Mono<ResponseEntity<Object>> readEntity(@PathVariable Long entityId) {
        return entityService.findById(entityId)
                .map(entity -> ResponseEntity.ok().<Object>body(entity))
                .defaultIfEmpty(notFound());
    }

    @GetMapping
    public Mono<ResponseEntity<Object>> readEntities(
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(name = EntityFilterBuilder.JSON_PATH, required = false) String jsonPath,
            @RequestParam(name = EntityFilterBuilder.JSON_VALUE, required = false) String jsonValue,
            @RequestParam(name = EntityFilterBuilder.JSON_CONTAINS, required = false) String jsonContains,
            @RequestParam(name = EntityFilterBuilder.JSON_KEY_EXISTS, required = false) String jsonKeyExists
    ) {
        Optional<QueryError> paginationError = filterBuilder.checkPagination(skip, limit);
        if (paginationError.isPresent()) {
            return Mono.just(badRequest(paginationError.get()));
        }

        FilterResult result = filterBuilder.build(EntityQuery.builder()
                .jsonPath(jsonPath)
                .jsonValue(jsonValue)
                .jsonContains(jsonContains)
                .jsonKeyExists(jsonKeyExists)
                .build());
        if (!result.isSuccess()) {
            return Mono.just(badRequest(result.getError()));
        }

        return entityService.findAll(result.getFilter(), skip, limit)
                .collectList()
                .map(entities -> ResponseEntity.ok().<Object>body(entities));
    }

    @PutMapping("/{entityId}")
    public Mono<ResponseEntity<Object>> updateEntity(
            @PathVariable Long entityId,
            @Valid @RequestBody EntityCreate request
    ) {
        return entityService.update(entityId, request)
                .map(entity -> ResponseEntity.ok().<Object>body(entity))
                .defaultIfEmpty(notFound());
    }

    @DeleteMapping("/{entityId}")
    public Mono<ResponseEntity<Object>> deleteEntity(@PathVariable Long entityId) {
        return entityService.delete(entityId)
                .map(deleted -> deleted
                        ? ResponseEntity.ok().<Object>body(Map.of("ok", true))
                        : notFound());
    }

    private static ResponseEntity<Object> notFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(NOT_FOUND_DETAIL));
    }

    private static ResponseEntity<Object> badRequest(QueryError error) {
        return ResponseEntity.badRequest().body(ErrorResponse.from(error));
    }
}
