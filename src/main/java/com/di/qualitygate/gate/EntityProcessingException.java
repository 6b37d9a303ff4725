package com.di.qualitygate.gate;

import com.di.qualitygate.model.SourceEntity;

/**
 * An entity could not be processed; nothing was published for it.
 */
public class EntityProcessingException extends RuntimeException {

    private final SourceEntity entity;

    public EntityProcessingException(SourceEntity entity, String message, Throwable cause) {
        super(message, cause);
        this.entity = entity;
    }

    public EntityProcessingException(SourceEntity entity, Throwable cause) {
        this(entity, "Entity " + entity + " failed: " + cause.getMessage(), cause);
    }

    public SourceEntity getEntity() {
        return entity;
    }
}
