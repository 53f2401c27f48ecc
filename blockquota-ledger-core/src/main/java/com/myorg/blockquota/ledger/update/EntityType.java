package com.myorg.blockquota.ledger.update;

import com.myorg.blockquota.contracts.core.exception.ProgrammingErrorException;

import java.util.Objects;
import java.util.Set;

/**
 * One updatable table: its name, primary key column and the columns callers may read or write.
 */
public record EntityType(String name, String table, String idColumn, Set<String> columns) {

    public EntityType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(idColumn, "idColumn");
        columns = Set.copyOf(columns);
        if (!columns.contains(idColumn)) {
            throw new IllegalArgumentException("idColumn " + idColumn + " must be one of the columns of " + name);
        }
    }

    public Field field(String column) {
        return new Field(this, requireColumn(column));
    }

    public String requireColumn(String column) {
        if (column == null || !columns.contains(column)) {
            throw new ProgrammingErrorException("Unknown field " + column + " for entity " + name);
        }
        return column;
    }

    @Override
    public String toString() {
        return name;
    }
}
