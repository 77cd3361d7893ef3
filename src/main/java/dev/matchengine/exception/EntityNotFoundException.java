package dev.matchengine.exception;

import dev.matchengine.model.EntityKind;

public class EntityNotFoundException extends RuntimeException {

    public EntityNotFoundException(EntityKind kind, String id) {
        super(kind.wireName() + " not found: " + id);
    }
}
