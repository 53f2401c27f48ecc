package com.myorg.blockquota.ledger.update;

import java.util.Objects;

/** A column qualified by the entity it belongs to. */
public record Field(EntityType entity, String column) {

    public Field {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(column, "column");
    }

    @Override
    public String toString() {
        return entity.name() + "." + column;
    }
}
