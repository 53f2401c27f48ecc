package com.myorg.blockquota.ledger.update;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code CASE WHEN <column matches condition> THEN <value> ... ELSE <value> END}. Branches are checked
 * in the order they were added.
 */
public record CaseValue(List<When> whens, UpdateValue otherwise) implements UpdateValue {

    public record When(String column, Condition condition, UpdateValue then) {
        public When {
            Objects.requireNonNull(column, "column");
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(then, "then");
        }
    }

    public CaseValue {
        if (whens == null || whens.isEmpty()) throw new IllegalArgumentException("CASE needs at least one WHEN");
        whens = List.copyOf(whens);
        otherwise = otherwise == null ? UpdateValue.literal(null) : otherwise;
    }

    public static Builder when(String column, Object expected, Object then) {
        return new Builder().when(column, expected, then);
    }

    @Override
    public boolean readsRow() {
        return true;
    }

    public static final class Builder {
        private final List<When> whens = new ArrayList<>();

        public Builder when(String column, Object expected, Object then) {
            whens.add(new When(column, Condition.of(expected), UpdateValue.of(then)));
            return this;
        }

        public CaseValue otherwise(Object value) {
            return new CaseValue(whens, UpdateValue.of(value));
        }
    }
}
