package com.example.entitystore.repository;

import com.example.entitystore.constants.ApiConstants;
import com.example.entitystore.entity.EntityRecord;
import com.example.entitystore.exception.EntityStorageException;
import com.example.entitystore.query.EntityFilter;
import com.example.entitystore.query.SqlFilter;
import com.example.entitystore.query.SqlFilterRenderer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.r2dbc.spi.Row;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.Map;

@Repository
@RequiredArgsConstructor
@Slf4j
public class EntityRepository {

    private static final String TABLE = ApiConstants.ENTITIES_TABLE;
    private static final String COLUMNS = "id, created_at, created_by, data::text AS data";

    private final DatabaseClient databaseClient;
    private final ObjectMapper objectMapper;
    private final SqlFilterRenderer filterRenderer;

    public Mono<EntityRecord> create(OffsetDateTime createdAt, String createdBy, Map<String, Object> data) {
        String dataJson;
        try {
            dataJson = objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.error("Error serializing entity data", e);
            return Mono.error(new EntityStorageException(null, "Failed to serialize entity data", e));
        }

        return databaseClient.sql(
                        "INSERT INTO " + TABLE + " (created_at, created_by, data) " +
                        "VALUES (:createdAt, :createdBy, CAST(:data AS jsonb)) " +
                        "RETURNING " + COLUMNS)
                .bind("createdAt", createdAt)
                .bind("createdBy", createdBy)
                .bind("data", dataJson)
                .map((row, metadata) -> toRecord(row))
                .one();
    }

    public Mono<EntityRecord> findById(Long id) {
        return databaseClient.sql("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE id = :id")
                .bind("id", id)
                .map((row, metadata) -> toRecord(row))
                .one();
    }

    /**
     * Scans entities matching {@code filter} in the table's natural order, skipping {@code skip}
     * rows and returning at most {@code limit}.
     */
    public Flux<EntityRecord> findAll(EntityFilter filter, int skip, int limit) {
        SqlFilter where = filterRenderer.render(filter);

        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM ").append(TABLE);
        if (where.hasCondition()) {
            sql.append(" WHERE ").append(where.getCondition());
        }
        sql.append(" LIMIT :limit OFFSET :skip");
        log.debug("Entity scan: {} with {} bound filter value(s)", sql, where.getBindings().size());

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql.toString())
                .bind("limit", limit)
                .bind("skip", skip);
        for (Map.Entry<String, Object> binding : where.getBindings().entrySet()) {
            spec = spec.bind(binding.getKey(), binding.getValue());
        }
        return spec.map((row, metadata) -> toRecord(row)).all();
    }

    /**
     * Replaces {@code created_by} and {@code data}; completes empty when no row has the id.
     */
    public Mono<EntityRecord> update(Long id, String createdBy, Map<String, Object> data) {
        String dataJson;
        try {
            dataJson = objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.error("Error serializing entity data for id {}", id, e);
            return Mono.error(new EntityStorageException(id, "Failed to serialize entity data", e));
        }

        return databaseClient.sql(
                        "UPDATE " + TABLE + " SET created_by = :createdBy, data = CAST(:data AS jsonb) " +
                        "WHERE id = :id RETURNING " + COLUMNS)
                .bind("createdBy", createdBy)
                .bind("data", dataJson)
                .bind("id", id)
                .map((row, metadata) -> toRecord(row))
                .one();
    }

    /**
     * Emits {@code true} when a row was deleted, {@code false} when none had the id.
     */
    public Mono<Boolean> deleteById(Long id) {
        return databaseClient.sql("DELETE FROM " + TABLE + " WHERE id = :id")
                .bind("id", id)
                .fetch()
                .rowsUpdated()
                .map(count -> count > 0);
    }

    public Mono<Integer> ping() {
        return databaseClient.sql("SELECT 1")
                .map((row, metadata) -> row.get(0, Integer.class))
                .one();
    }

    private EntityRecord toRecord(Row row) {
        return EntityRecord.builder()
                .id(row.get("id", Long.class))
                .createdAt(row.get("created_at", OffsetDateTime.class))
                .createdBy(row.get("created_by", String.class))
                .data(row.get("data", String.class))
                .build();
    }
}
