package com.example.entitystore.exception;

/**
 * Failure converting an entity's {@code data} document to or from its stored JSON text.
 */
public class EntityStorageException extends RuntimeException {
    private final Long entityId;

    public EntityStorageException(Long entityId, String message, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
    }

    public Long getEntityId() {
        return entityId;
    }
}
