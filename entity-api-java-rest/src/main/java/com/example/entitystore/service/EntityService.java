package com.example.entitystore.service;

import com.example.entitystore.config.AppConfig;
import com.example.entitystore.constants.ApiConstants;
import com.example.entitystore.dto.EntityCreate;
import com.example.entitystore.dto.EntityRead;
import com.example.entitystore.entity.EntityRecord;
import com.example.entitystore.exception.EntityStorageException;
import com.example.entitystore.query.EntityFilter;
import com.example.entitystore.repository.EntityRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Entity CRUD on top of {@link EntityRepository}. Lookups by id complete empty when the id is
 * unknown; the HTTP layer turns that into a 404.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityService {

    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {
    };

    private final EntityRepository entityRepository;
    private final ObjectMapper objectMapper;
    private final AppConfig config;

    @Transactional
    public Mono<EntityRead> create(EntityCreate request) {
        OffsetDateTime createdAt = OffsetDateTime.now();
        log.info("{} Creating entity for: {}", ApiConstants.API_NAME, request.getCreatedBy());

        return entityRepository.create(createdAt, request.getCreatedBy(), request.getData())
                .map(this::toRead)
                .doOnNext(entity -> log.info("{} Created entity: {}", ApiConstants.API_NAME, entity.getId()))
                .doOnError(error -> log.error("{} Failed to create entity: {}", ApiConstants.API_NAME, error.getMessage()));
    }

    public Mono<EntityRead> findById(Long id) {
        return entityRepository.findById(id)
                .map(this::toRead)
                .switchIfEmpty(Mono.defer(() -> {
                    log.debug("{} Entity not found: {}", ApiConstants.API_NAME, id);
                    return Mono.empty();
                }));
    }

    public Flux<EntityRead> findAll(EntityFilter filter, int skip, int limit) {
        log.debug("{} Listing entities: skip={}, limit={}", ApiConstants.API_NAME, skip, limit);
        return entityRepository.findAll(filter, skip, limit)
                .map(this::toRead)
                .doOnError(error -> log.error("{} Failed to list entities: {}", ApiConstants.API_NAME, error.getMessage()));
    }

    @Transactional
    public Mono<EntityRead> update(Long id, EntityCreate request) {
        log.info("{} Updating entity: {}", ApiConstants.API_NAME, id);
        return entityRepository.update(id, request.getCreatedBy(), request.getData())
                .map(this::toRead)
                .doOnNext(entity -> log.info("{} Updated entity: {}", ApiConstants.API_NAME, entity.getId()))
                .doOnError(error -> log.error("{} Failed to update entity {}: {}", ApiConstants.API_NAME, id, error.getMessage()));
    }

    /**
     * Emits {@code true} when the entity existed and was removed.
     */
    @Transactional
    public Mono<Boolean> delete(Long id) {
        return entityRepository.deleteById(id)
                .doOnNext(deleted -> {
                    if (deleted) {
                        log.info("{} Deleted entity: {}", ApiConstants.API_NAME, id);
                    } else {
                        log.info("{} Delete skipped, entity not found: {}", ApiConstants.API_NAME, id);
                    }
                })
                .doOnError(error -> log.error("{} Failed to delete entity {}: {}", ApiConstants.API_NAME, id, error.getMessage()));
    }

    /**
     * Runs a trivial query against the database, bounded by {@code entity-store.health.timeout}.
     */
    public Mono<Boolean> isDatabaseHealthy() {
        return entityRepository.ping()
                .timeout(config.getHealth().getTimeout())
                .map(result -> true)
                .defaultIfEmpty(false)
                .onErrorResume(error -> {
                    log.warn("{} Database health check failed: {}", ApiConstants.API_NAME, error.toString());
                    return Mono.just(false);
                });
    }

    private EntityRead toRead(EntityRecord record) {
        Map<String, Object> data;
        try {
            data = record.getData() == null ? null : objectMapper.readValue(record.getData(), DATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new EntityStorageException(record.getId(), "Failed to read data of entity " + record.getId(), e);
        }
        return EntityRead.builder()
                .id(record.getId())
                .createdAt(record.getCreatedAt())
                .createdBy(record.getCreatedBy())
                .data(data)
                .build();
    }
}
