package com.myorg.blockquota.ledger.update;

import java.util.Objects;
import java.util.Set;

/**
 * New value of a column in a conditional update: a literal, a reference to another column of the
 * same row, arithmetic over such a column, or a {@link CaseValue}.
 */
public interface UpdateValue {

    static UpdateValue literal(Object value) {
        return new Literal(value);
    }

    static UpdateValue field(String column) {
        return new FieldRef(column);
    }

    static UpdateValue expression(String column, String operator, Object operand) {
        return new Expression(column, operator, operand);
    }

    /** Wraps plain objects as literals; update values pass through. */
    static UpdateValue of(Object value) {
        if (value instanceof UpdateValue v) return v;
        return new Literal(value);
    }

    /** True when the value reads columns of the row being updated. */
    default boolean readsRow() {
        return false;
    }

    record Literal(Object value) implements UpdateValue {}

    record FieldRef(String column) implements UpdateValue {
        public FieldRef {
            Objects.requireNonNull(column, "column");
        }

        @Override
        public boolean readsRow() {
            return true;
        }
    }

    /** {@code column <operator> operand}, e.g. {@code size + 10}. */
    record Expression(String column, String operator, Object operand) implements UpdateValue {
        private static final Set<String> OPERATORS = Set.of("+", "-", "*", "/");

        public Expression {
            Objects.requireNonNull(column, "column");
            if (!OPERATORS.contains(operator)) {
                throw new IllegalArgumentException("Unsupported operator " + operator);
            }
        }

        @Override
        public boolean readsRow() {
            return true;
        }
    }
}
